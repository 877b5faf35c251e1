package com.enterprise.taskdistribution.exception;

/**
 * Exception thrown when caller input is malformed. Raised before any state change.
 */
public class ValidationException extends IllegalArgumentException {

    private final String field;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
