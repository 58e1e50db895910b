package fr.lapetina.lineplanner.domain.placement;

import fr.lapetina.lineplanner.domain.model.BalancedOperation;
import fr.lapetina.lineplanner.domain.model.Facing;
import fr.lapetina.lineplanner.domain.model.Lane;
import fr.lapetina.lineplanner.domain.model.LaneCursors;
import fr.lapetina.lineplanner.domain.model.PlacedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out the assembly section across all four lanes.
 *
 * Lanes A, B and C run three identical sub-lines that each assemble complete
 * garments, so machines of one operation are dealt round-robin across them,
 * one row per three machines. Buttoning runs sequentially in lane D. Every
 * assembly station faces front.
 */
public final class AssemblyPlacement implements SectionPlacement {

    private static final Logger log = LoggerFactory.getLogger(AssemblyPlacement.class);

    static final List<Lane> ASSEMBLY_LANES = List.of(Lane.A, Lane.B, Lane.C);
    static final Lane BUTTONING_LANE = Lane.D;

    private final LayoutSettings.Spacing spacing;
    private final StationRules stationRules;
    private final EntityFactory entities;

    public AssemblyPlacement(LayoutSettings settings, StationRules stationRules, EntityFactory entities) {
        this.spacing = settings.spacing();
        this.stationRules = stationRules;
        this.entities = entities;
    }

    @Override
    public SectionResult place(String section, List<BalancedOperation> operations, LaneCursors cursors) {
        List<PlacedEntity> placed = new ArrayList<>();

        double startX = cursors.maxAll() + spacing.sectionGap();
        cursors = cursors.syncAll(startX);
        placed.add(entities.sectionBoard(section, startX, 0));

        List<BalancedOperation> mainOps = new ArrayList<>();
        List<BalancedOperation> buttonOps = new ArrayList<>();
        for (BalancedOperation item : operations) {
            if (stationRules.isButtoning(item.operation())) {
                buttonOps.add(item);
            } else {
                mainOps.add(item);
            }
        }

        log.debug("Placing assembly section '{}': startX={}, main={}, buttoning={}",
                section, startX, mainOps.size(), buttonOps.size());

        int width = ASSEMBLY_LANES.size();
        double mainCursor = startX;
        for (BalancedOperation item : mainOps) {
            int count = item.requiredMachines();
            for (int k = 0; k < count; k++) {
                Lane lane = ASSEMBLY_LANES.get(k % width);
                double x = mainCursor + (k / width) * spacing.machinePitch();
                placed.add(entities.machine(item.operation(), lane, x, k, section, Facing.FRONT));
            }
            int rows = (count + width - 1) / width;
            mainCursor += rows * spacing.machinePitch();
        }

        double buttonCursor = startX;
        for (BalancedOperation item : buttonOps) {
            for (int k = 0; k < item.requiredMachines(); k++) {
                placed.add(entities.machine(item.operation(), BUTTONING_LANE, buttonCursor, k, section, Facing.FRONT));
                buttonCursor += spacing.machinePitch();
            }
        }

        cursors = cursors.syncAll(Math.max(mainCursor, buttonCursor));
        return new SectionResult(placed, cursors);
    }
}
