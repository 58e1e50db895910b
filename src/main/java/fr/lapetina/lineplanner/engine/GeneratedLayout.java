package fr.lapetina.lineplanner.engine;

import fr.lapetina.lineplanner.domain.model.BalancedOperation;
import fr.lapetina.lineplanner.domain.model.PlacedEntity;

import java.time.Instant;
import java.util.List;

/**
 * Output of one generation run with its balancing step and summary.
 */
public record GeneratedLayout(
        String layoutId,
        Instant generatedAt,
        List<BalancedOperation> balanced,
        List<PlacedEntity> entities,
        LayoutSummary summary
) {
    public GeneratedLayout {
        balanced = List.copyOf(balanced);
        entities = List.copyOf(entities);
    }
}
