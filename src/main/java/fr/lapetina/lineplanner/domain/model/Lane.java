package fr.lapetina.lineplanner.domain.model;

/**
 * The four fixed parallel lanes of a sewing line.
 *
 * A and B form the left group, C and D the right group. A and C are the
 * inner lanes, closest to the centre aisle.
 */
public enum Lane {
    A(LaneGroup.AB),
    B(LaneGroup.AB),
    C(LaneGroup.CD),
    D(LaneGroup.CD);

    private final LaneGroup group;

    Lane(LaneGroup group) {
        this.group = group;
    }

    public LaneGroup getGroup() {
        return group;
    }

    public boolean isInner() {
        return this == group.inner();
    }
}
