package fr.lapetina.lineplanner.domain.exception;

import fr.lapetina.lineplanner.domain.model.LayoutErrorType;

/**
 * Base exception for failures that abort a layout generation.
 * No partial layout is ever returned alongside one of these.
 */
public class LayoutException extends RuntimeException {

    private final LayoutErrorType errorType;

    public LayoutException(LayoutErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public LayoutErrorType getErrorType() {
        return errorType;
    }
}
