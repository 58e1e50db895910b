package fr.lapetina.lineplanner.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.lineplanner.domain.catalog.MachineCatalog;
import fr.lapetina.lineplanner.engine.GeneratedLayout;
import fr.lapetina.lineplanner.engine.LayoutSummary;

import java.time.Instant;
import java.util.List;

/**
 * Response of {@code POST /v1/layout}.
 */
public class LayoutResponse {

    @JsonProperty("layout_id")
    private String layoutId;

    @JsonProperty("generated_at")
    private Instant generatedAt;

    private LayoutSummary summary;

    private List<PlacedEntityDto> entities;

    public static LayoutResponse from(GeneratedLayout layout, MachineCatalog catalog) {
        LayoutResponse response = new LayoutResponse();
        response.layoutId = layout.layoutId();
        response.generatedAt = layout.generatedAt();
        response.summary = layout.summary();
        response.entities = layout.entities().stream()
                .map(entity -> PlacedEntityDto.from(entity, catalog))
                .toList();
        return response;
    }

    public String getLayoutId() { return layoutId; }
    public Instant getGeneratedAt() { return generatedAt; }
    public LayoutSummary getSummary() { return summary; }
    public List<PlacedEntityDto> getEntities() { return entities; }
}
