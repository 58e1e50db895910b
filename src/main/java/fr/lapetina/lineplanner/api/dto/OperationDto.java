package fr.lapetina.lineplanner.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.lineplanner.domain.model.Operation;

/**
 * Operation as exchanged with the ingestion and viewer side.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OperationDto {

    @JsonProperty("op_no")
    private String opNo;

    @JsonProperty("op_name")
    private String opName;

    @JsonProperty("machine_type")
    private String machineType;

    private Double smv;

    private String section;

    public String getOpNo() { return opNo; }
    public void setOpNo(String opNo) { this.opNo = opNo; }

    public String getOpName() { return opName; }
    public void setOpName(String opName) { this.opName = opName; }

    public String getMachineType() { return machineType; }
    public void setMachineType(String machineType) { this.machineType = machineType; }

    public Double getSmv() { return smv; }
    public void setSmv(Double smv) { this.smv = smv; }

    public String getSection() { return section; }
    public void setSection(String section) { this.section = section; }

    /**
     * Missing SMV maps to zero, which still yields one machine.
     */
    public Operation toOperation() {
        return new Operation(opNo, opName, machineType, smv != null ? smv : 0.0, section);
    }

    public static OperationDto from(Operation operation) {
        OperationDto dto = new OperationDto();
        dto.opNo = operation.opNo();
        dto.opName = operation.opName();
        dto.machineType = operation.machineType();
        dto.smv = operation.smv();
        dto.section = operation.section();
        return dto;
    }
}
