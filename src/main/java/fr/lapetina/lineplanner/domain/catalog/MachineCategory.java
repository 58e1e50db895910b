package fr.lapetina.lineplanner.domain.catalog;

/**
 * Broad machine families, used by viewers to pick a model and colour.
 */
public enum MachineCategory {
    /** Single needle lock stitch and other flat-bed stitchers */
    SNLS,
    /** Overlock / edge cutting */
    SNEC,
    /** Ironing and pressing tables */
    IRON,
    /** Button hole and button stitch */
    BUTTON,
    BARTACK,
    /** Feed-off-arm, turning, pointing, contour and similar */
    SPECIAL,
    /** Manual helper tables */
    HELPER,
    DEFAULT
}
