package fr.lapetina.lineplanner.domain.placement;

import fr.lapetina.lineplanner.domain.model.Facing;
import fr.lapetina.lineplanner.domain.model.Lane;
import fr.lapetina.lineplanner.domain.model.Operation;

import java.util.Optional;

/**
 * Per-station rules: which way an operator faces and whether an operation
 * belongs to the buttoning sub-flow.
 *
 * Paired lanes face each other across their aisle (A and B, C and D).
 * Pressing and inspection stations are read from one side only, so they
 * always face front regardless of lane.
 */
public final class StationRules {

    private final ClassificationTable<Facing> forcedFacing;
    private final ClassificationTable<Boolean> buttoning;

    public StationRules(LayoutSettings.Keywords keywords) {
        this.forcedFacing = ClassificationTable.<Facing>builder()
                .whenContainsAny(keywords.frontFacing(), Facing.FRONT)
                .build();
        this.buttoning = ClassificationTable.<Boolean>builder()
                .whenContainsAny(keywords.buttoning(), Boolean.TRUE)
                .build();
    }

    /**
     * Facing for a machine in a lane, honouring machine-type overrides.
     */
    public Facing facingFor(Lane lane, String machineType) {
        return forcedFacing(machineType).orElse(laneFacing(lane));
    }

    public Optional<Facing> forcedFacing(String machineType) {
        return forcedFacing.classify(machineType);
    }

    /**
     * Default facing of a lane: A faces B, B faces A, C faces D, D faces C.
     */
    public static Facing laneFacing(Lane lane) {
        return switch (lane) {
            case A, D -> Facing.LEFT;
            case B, C -> Facing.RIGHT;
        };
    }

    /**
     * True when the machine type or the operation name mentions buttoning.
     */
    public boolean isButtoning(Operation operation) {
        return buttoning.classifyOrDefault(operation.machineType(), Boolean.FALSE)
                || buttoning.classifyOrDefault(operation.opName(), Boolean.FALSE);
    }
}
