package fr.lapetina.lineplanner.domain.model;

/**
 * A pair of facing lanes that share a section.
 */
public enum LaneGroup {
    AB,
    CD;

    public Lane inner() {
        return this == AB ? Lane.A : Lane.C;
    }

    public Lane outer() {
        return this == AB ? Lane.B : Lane.D;
    }

    /**
     * Sign of the across-line direction pointing away from the centre aisle.
     */
    public double outwardSign() {
        return this == AB ? -1.0 : 1.0;
    }
}
