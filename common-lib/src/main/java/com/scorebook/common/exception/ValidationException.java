package com.scorebook.common.exception;

/**
 * Input to a derivation is structurally invalid (empty lineup, malformed event).
 * Fatal to the single call that raised it; never retried.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super("[" + field + "] " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
