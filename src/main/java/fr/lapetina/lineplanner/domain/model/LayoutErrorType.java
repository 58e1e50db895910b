package fr.lapetina.lineplanner.domain.model;

/**
 * Error taxonomy for layout generation.
 * Used for HTTP status mapping and metrics tags.
 */
public enum LayoutErrorType {
    /** Target output or working time is not strictly positive */
    INVALID_DEMAND,

    /** An operation is missing a required field or carries an impossible value */
    MALFORMED_OPERATION,

    /** Request body could not be read */
    INVALID_REQUEST,

    /** Internal system error */
    INTERNAL_ERROR
}
