package fr.lapetina.lineplanner.domain.placement;

import fr.lapetina.lineplanner.domain.model.LaneCursors;
import fr.lapetina.lineplanner.domain.model.PlacedEntity;

import java.util.List;

/**
 * Entities placed for one step of the walk, and the cursors after it.
 */
public record SectionResult(List<PlacedEntity> entities, LaneCursors cursors) {
    public SectionResult {
        entities = List.copyOf(entities);
    }

    public static SectionResult empty(LaneCursors cursors) {
        return new SectionResult(List.of(), cursors);
    }
}
