package fr.lapetina.lineplanner.engine;

import fr.lapetina.lineplanner.domain.model.BalancedOperation;
import fr.lapetina.lineplanner.domain.model.Lane;
import fr.lapetina.lineplanner.domain.model.PlacedEntity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Headline figures of a generated layout.
 *
 * @param totalSmv        sum of SMV over all operations, minutes per unit
 * @param taktTime        working minutes per unit of output
 * @param totalMachines   machine instances placed
 * @param fixtures        boards, tables, trolleys and other fixtures placed
 * @param machinesPerLane machine instances per lane
 * @param lineLength      furthest along-line offset of any entity
 */
public record LayoutSummary(
        double totalSmv,
        double taktTime,
        int totalMachines,
        int fixtures,
        Map<Lane, Integer> machinesPerLane,
        double lineLength
) {
    public LayoutSummary {
        machinesPerLane = Collections.unmodifiableMap(new EnumMap<>(machinesPerLane));
    }

    public static LayoutSummary of(List<BalancedOperation> balanced, double taktTime, List<PlacedEntity> entities) {
        double totalSmv = balanced.stream()
                .mapToDouble(item -> item.operation().smv())
                .sum();

        Map<Lane, Integer> perLane = new EnumMap<>(Lane.class);
        for (Lane lane : Lane.values()) {
            perLane.put(lane, 0);
        }
        int machines = 0;
        double lineLength = 0;
        for (PlacedEntity entity : entities) {
            if (entity.isMachine()) {
                machines++;
                perLane.merge(entity.lane(), 1, Integer::sum);
            }
            lineLength = Math.max(lineLength, entity.position().x());
        }

        return new LayoutSummary(totalSmv, taktTime, machines, entities.size() - machines, perLane, lineLength);
    }
}
