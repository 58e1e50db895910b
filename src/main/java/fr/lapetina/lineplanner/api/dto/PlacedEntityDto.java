package fr.lapetina.lineplanner.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.lineplanner.domain.catalog.Footprint;
import fr.lapetina.lineplanner.domain.catalog.MachineCatalog;
import fr.lapetina.lineplanner.domain.model.PlacedEntity;
import fr.lapetina.lineplanner.domain.model.Vector3;

/**
 * Placed entity as sent to viewers.
 * Fixtures carry a {@code kind} other than {@code MACHINE} and no operation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlacedEntityDto {

    private String id;
    private String kind;
    private String label;
    private OperationDto operation;
    private String lane;
    private Vector3 position;
    private Vector3 rotation;
    private String section;

    @JsonProperty("machine_index")
    private Integer machineIndex;

    private String category;
    private Footprint footprint;

    @JsonProperty("is_inspection")
    private boolean inspection;

    @JsonProperty("is_trolley")
    private boolean trolley;

    @JsonProperty("is_board")
    private boolean board;

    public static PlacedEntityDto from(PlacedEntity entity, MachineCatalog catalog) {
        PlacedEntityDto dto = new PlacedEntityDto();
        dto.id = entity.id();
        dto.label = entity.source().label();
        dto.lane = entity.lane().name();
        dto.position = entity.position();
        dto.rotation = entity.rotation();
        dto.section = entity.section();
        dto.inspection = entity.isInspection();
        dto.trolley = entity.isTrolley();
        dto.board = entity.isBoard();
        dto.kind = entity.fixtureType().map(Enum::name).orElse("MACHINE");
        entity.operation().ifPresent(op -> {
            dto.operation = OperationDto.from(op);
            dto.machineIndex = entity.sequenceIndex();
            dto.category = catalog.categoryOf(op.machineType()).name();
            dto.footprint = catalog.footprintOf(op.machineType());
        });
        return dto;
    }

    public String getId() { return id; }
    public String getKind() { return kind; }
    public String getLabel() { return label; }
    public OperationDto getOperation() { return operation; }
    public String getLane() { return lane; }
    public Vector3 getPosition() { return position; }
    public Vector3 getRotation() { return rotation; }
    public String getSection() { return section; }
    public Integer getMachineIndex() { return machineIndex; }
    public String getCategory() { return category; }
    public Footprint getFootprint() { return footprint; }
    public boolean isInspection() { return inspection; }
    public boolean isTrolley() { return trolley; }
    public boolean isBoard() { return board; }
}
