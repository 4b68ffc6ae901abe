package com.aegis.allocation.api.exceptions;

/**
 * Thrown at the intake boundary when a classification payload is not a
 * well-typed selection: an unknown field, a non-boolean flag, or a system
 * scope outside the allowed values.
 *
 * <p>The allocation rules themselves never throw this; once a selection has
 * been built, every combination of flags has a defined result.
 */
public class InvalidSelectionException extends RuntimeException {

    private final String field;

    public InvalidSelectionException(String field, String message) {
        super(message);
        this.field = field;
    }

    public InvalidSelectionException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Name of the offending field as submitted, or null if the payload as a whole was rejected.
     */
    public String getField() {
        return field;
    }
}
