package fr.lapetina.lineplanner.domain.exception;

import fr.lapetina.lineplanner.domain.model.LayoutErrorType;

/**
 * Thrown when an operation lacks a required field.
 */
public final class MalformedOperationException extends LayoutException {

    private final int index;

    public MalformedOperationException(int index, String reason) {
        super(LayoutErrorType.MALFORMED_OPERATION,
                "Malformed operation at index " + index + ": " + reason);
        this.index = index;
    }

    /**
     * Position of the offending operation in the input list.
     */
    public int getIndex() {
        return index;
    }
}
