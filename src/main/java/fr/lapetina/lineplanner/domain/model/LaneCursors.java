package fr.lapetina.lineplanner.domain.model;

/**
 * Next free along-line offset for each lane.
 *
 * Immutable: every operation returns a new value, so the placement state
 * is threaded explicitly through the placer. Offsets never decrease.
 */
public record LaneCursors(double a, double b, double c, double d) {

    public static final LaneCursors START = new LaneCursors(0, 0, 0, 0);

    public double get(Lane lane) {
        return switch (lane) {
            case A -> a;
            case B -> b;
            case C -> c;
            case D -> d;
        };
    }

    /**
     * Moves one lane forward to {@code x}; a smaller value is ignored.
     */
    public LaneCursors advanceTo(Lane lane, double x) {
        double next = Math.max(get(lane), x);
        return switch (lane) {
            case A -> new LaneCursors(next, b, c, d);
            case B -> new LaneCursors(a, next, c, d);
            case C -> new LaneCursors(a, b, next, d);
            case D -> new LaneCursors(a, b, c, next);
        };
    }

    public LaneCursors advanceBy(Lane lane, double delta) {
        return advanceTo(lane, get(lane) + delta);
    }

    public double max(LaneGroup group) {
        return Math.max(get(group.inner()), get(group.outer()));
    }

    public double maxAll() {
        return Math.max(Math.max(a, b), Math.max(c, d));
    }

    /**
     * Moves both lanes of a group to {@code x}.
     */
    public LaneCursors syncGroup(LaneGroup group, double x) {
        return advanceTo(group.inner(), x).advanceTo(group.outer(), x);
    }

    public LaneCursors syncGroupBy(LaneGroup group, double delta) {
        return advanceBy(group.inner(), delta).advanceBy(group.outer(), delta);
    }

    /**
     * Moves all four lanes to {@code x}.
     */
    public LaneCursors syncAll(double x) {
        return syncGroup(LaneGroup.AB, x).syncGroup(LaneGroup.CD, x);
    }
}
