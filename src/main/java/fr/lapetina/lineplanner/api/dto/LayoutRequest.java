package fr.lapetina.lineplanner.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.lineplanner.domain.model.Operation;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code POST /v1/layout} and {@code POST /v1/balance}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LayoutRequest {

    private List<OperationDto> operations = new ArrayList<>();

    @JsonProperty("target_output")
    @JsonAlias("targetOutput")
    private Double targetOutput;

    @JsonProperty("working_minutes")
    @JsonAlias("workingMinutes")
    private Double workingMinutes;

    public List<OperationDto> getOperations() { return operations; }
    public void setOperations(List<OperationDto> operations) { this.operations = operations; }

    public Double getTargetOutput() { return targetOutput; }
    public void setTargetOutput(Double targetOutput) { this.targetOutput = targetOutput; }

    public Double getWorkingMinutes() { return workingMinutes; }
    public void setWorkingMinutes(Double workingMinutes) { this.workingMinutes = workingMinutes; }

    public List<Operation> toOperations() {
        List<Operation> result = new ArrayList<>();
        if (operations != null) {
            for (OperationDto dto : operations) {
                result.add(dto != null ? dto.toOperation() : null);
            }
        }
        return result;
    }
}
