package fr.lapetina.lineplanner.domain.placement;

import fr.lapetina.lineplanner.domain.model.LaneGroup;

/**
 * How a section is laid out.
 */
public enum SectionKind {
    /** Parts preparation on lanes A and B. */
    AB(LaneGroup.AB),
    /** Parts preparation on lanes C and D. */
    CD(LaneGroup.CD),
    /** Garment assembly across all four lanes. */
    ASSEMBLY(null);

    private final LaneGroup group;

    SectionKind(LaneGroup group) {
        this.group = group;
    }

    /**
     * Lane pair for parts preparation; null for assembly.
     */
    public LaneGroup getGroup() {
        return group;
    }

    public boolean isAssembly() {
        return this == ASSEMBLY;
    }
}
