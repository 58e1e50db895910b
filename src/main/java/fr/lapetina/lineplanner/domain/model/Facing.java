package fr.lapetina.lineplanner.domain.model;

/**
 * Canonical directions an operator station can face.
 * The yaw for each direction comes from layout settings.
 */
public enum Facing {
    /** Towards -X, the head of the line. */
    FRONT,
    /** Towards +X. */
    BACK,
    /** Towards -Z. */
    LEFT,
    /** Towards +Z. */
    RIGHT
}
