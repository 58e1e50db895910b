package fr.lapetina.lineplanner.domain.placement;

import fr.lapetina.lineplanner.domain.model.BalancedOperation;
import fr.lapetina.lineplanner.domain.model.Lane;
import fr.lapetina.lineplanner.domain.model.LaneCursors;
import fr.lapetina.lineplanner.domain.model.LaneGroup;
import fr.lapetina.lineplanner.domain.model.PlacedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out a parts preparation section on one lane pair.
 *
 * <ol>
 *   <li>Both lanes of the pair start flush at the furthest cursor plus the section gap.</li>
 *   <li>A section board marks the start; machines begin after the board clearance.</li>
 *   <li>Operations alternate between the inner and outer lane. All machines of
 *       one operation stay together in one lane.</li>
 *   <li>An inspection table and a trolley close the section on the inner lane.
 *       Both cursors of the pair end past whichever of the two sits furthest along.</li>
 * </ol>
 */
public final class PartsPreparationPlacement implements SectionPlacement {

    private static final Logger log = LoggerFactory.getLogger(PartsPreparationPlacement.class);

    private final LaneGroup group;
    private final LayoutSettings.Spacing spacing;
    private final LayoutSettings.LaneOffsets lanes;
    private final EntityFactory entities;

    public PartsPreparationPlacement(LaneGroup group, LayoutSettings settings, EntityFactory entities) {
        this.group = group;
        this.spacing = settings.spacing();
        this.lanes = settings.lanes();
        this.entities = entities;
    }

    @Override
    public SectionResult place(String section, List<BalancedOperation> operations, LaneCursors cursors) {
        List<PlacedEntity> placed = new ArrayList<>();

        double startX = cursors.max(group) + spacing.sectionGap();
        cursors = cursors.syncGroup(group, startX);

        placed.add(entities.sectionBoard(section, startX, lanes.of(group.inner())));
        cursors = cursors.syncGroupBy(group, spacing.boardClearance());

        log.debug("Placing section '{}' on {}: startX={}, operations={}",
                section, group, startX, operations.size());

        Lane lane = group.inner();
        for (BalancedOperation item : operations) {
            double x = cursors.get(lane);
            for (int k = 0; k < item.requiredMachines(); k++) {
                placed.add(entities.machine(item.operation(), lane, x, k, section));
                x += spacing.machinePitch();
            }
            cursors = cursors.advanceTo(lane, x);
            lane = lane == group.inner() ? group.outer() : group.inner();
        }

        double inspectX = cursors.max(group) + spacing.inspectionAlongOffset();
        double trolleyX = inspectX + spacing.trolleyAlongOffset();
        placed.add(entities.inspectionTable(section, group, inspectX));
        placed.add(entities.trolley(section, group, trolleyX));
        cursors = cursors.syncGroup(group, Math.max(inspectX, trolleyX) + spacing.fixtureClearance());

        return new SectionResult(placed, cursors);
    }
}
