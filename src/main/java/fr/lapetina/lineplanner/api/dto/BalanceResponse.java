package fr.lapetina.lineplanner.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.lineplanner.domain.model.BalancedOperation;

import java.util.List;

/**
 * Response of {@code POST /v1/balance}.
 */
public class BalanceResponse {

    @JsonProperty("takt_time")
    private double taktTime;

    @JsonProperty("total_machines")
    private int totalMachines;

    private List<Item> operations;

    public static BalanceResponse from(List<BalancedOperation> balanced, double taktTime) {
        BalanceResponse response = new BalanceResponse();
        response.taktTime = taktTime;
        response.operations = balanced.stream()
                .map(item -> new Item(OperationDto.from(item.operation()), item.requiredMachines()))
                .toList();
        response.totalMachines = balanced.stream()
                .mapToInt(BalancedOperation::requiredMachines)
                .sum();
        return response;
    }

    public double getTaktTime() { return taktTime; }
    public int getTotalMachines() { return totalMachines; }
    public List<Item> getOperations() { return operations; }

    public record Item(
            OperationDto operation,
            @JsonProperty("required_machines") int requiredMachines
    ) {
    }
}
