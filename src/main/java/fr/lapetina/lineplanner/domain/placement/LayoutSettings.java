package fr.lapetina.lineplanner.domain.placement;

import fr.lapetina.lineplanner.domain.model.Facing;
import fr.lapetina.lineplanner.domain.model.Lane;

import java.util.List;
import java.util.Objects;

/**
 * Immutable layout constants: lane geometry, spacing, facing yaws and the
 * keyword tables used for classification. Distances are in metres, angles
 * in radians.
 */
public record LayoutSettings(
        LaneOffsets lanes,
        Spacing spacing,
        FacingYaws facing,
        Keywords keywords,
        boolean transitionFixtures
) {
    public LayoutSettings {
        Objects.requireNonNull(lanes, "Lane offsets are required");
        Objects.requireNonNull(spacing, "Spacing is required");
        Objects.requireNonNull(facing, "Facing yaws are required");
        Objects.requireNonNull(keywords, "Keywords are required");
    }

    public static LayoutSettings defaults() {
        return new LayoutSettings(
                LaneOffsets.defaults(),
                Spacing.defaults(),
                FacingYaws.defaults(),
                Keywords.defaults(),
                false
        );
    }

    public LayoutSettings withTransitionFixtures(boolean enabled) {
        return new LayoutSettings(lanes, spacing, facing, keywords, enabled);
    }

    /**
     * Across-line (Z) offset of each lane.
     */
    public record LaneOffsets(double laneA, double laneB, double laneC, double laneD) {

        public static LaneOffsets defaults() {
            return new LaneOffsets(-1.2, -2.8, 1.2, 2.8);
        }

        public double of(Lane lane) {
            return switch (lane) {
                case A -> laneA;
                case B -> laneB;
                case C -> laneC;
                case D -> laneD;
            };
        }
    }

    /**
     * Along-line distances between machines and fixtures.
     *
     * @param machinePitch               distance between consecutive machines in a lane
     * @param sectionGap                 gap before every section start
     * @param boardClearance             room left after a section board
     * @param boardHeight                height at which section boards float
     * @param inspectionAlongOffset      inspection table distance past the section end
     * @param inspectionAcrossOffset     inspection table offset from the inner lane, outward
     * @param trolleyAlongOffset         trolley distance past the inspection table
     * @param trolleyAcrossOffset        trolley offset from the inner lane, outward
     * @param fixtureClearance           cursor advance past the furthest closing fixture
     * @param transitionFixtureOffset    supermarket/table distance past the last preparation section
     * @param transitionFixtureClearance cursor advance past the transition fixtures
     */
    public record Spacing(
            double machinePitch,
            double sectionGap,
            double boardClearance,
            double boardHeight,
            double inspectionAlongOffset,
            double inspectionAcrossOffset,
            double trolleyAlongOffset,
            double trolleyAcrossOffset,
            double fixtureClearance,
            double transitionFixtureOffset,
            double transitionFixtureClearance
    ) {
        public static Spacing defaults() {
            return new Spacing(2.0, 2.0, 1.5, 2.5, 1.0, 0.0, 3.5, 0.5, 2.5, 1.0, 2.5);
        }
    }

    /**
     * Yaw for each canonical facing.
     */
    public record FacingYaws(double front, double back, double left, double right) {

        public static FacingYaws defaults() {
            return new FacingYaws(-Math.PI / 2, Math.PI / 2, Math.PI, 0.0);
        }

        public double of(Facing facing) {
            return switch (facing) {
                case FRONT -> front;
                case BACK -> back;
                case LEFT -> left;
                case RIGHT -> right;
            };
        }
    }

    /**
     * Lower-case keywords matched as substrings, case-insensitively.
     */
    public record Keywords(
            List<String> assembly,
            List<String> cdSections,
            List<String> abSections,
            List<String> buttoning,
            List<String> frontFacing
    ) {
        public Keywords {
            assembly = List.copyOf(assembly);
            cdSections = List.copyOf(cdSections);
            abSections = List.copyOf(abSections);
            buttoning = List.copyOf(buttoning);
            frontFacing = List.copyOf(frontFacing);
        }

        public static Keywords defaults() {
            return new Keywords(
                    List.of("assembly"),
                    List.of("collar", "front"),
                    List.of("cuff", "sleeve", "back"),
                    List.of("button"),
                    List.of("iron", "press", "inspection")
            );
        }
    }
}
