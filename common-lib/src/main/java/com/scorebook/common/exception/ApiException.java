package com.scorebook.common.exception;

/**
 * Non-2xx response from the scorebook backend.
 *
 * <p>The status code is carried for the caller's error message only. Optimistic
 * mutations treat every {@code ApiException} the same way: roll back and surface.
 */
public class ApiException extends RuntimeException {

    private final int statusCode;
    private final String errorType;

    public ApiException(int statusCode, String message, String errorType) {
        super(message);
        this.statusCode = statusCode;
        this.errorType  = errorType;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorType() {
        return errorType;
    }

    public boolean isUnauthorized()    { return statusCode == 401; }
    public boolean isForbidden()       { return statusCode == 403; }
    public boolean isNotFound()        { return statusCode == 404; }
    public boolean isValidationError() { return statusCode == 400; }
    public boolean isServerError()     { return statusCode >= 500; }

    @Override
    public String toString() {
        return "ApiException(" + statusCode + "): " + getMessage()
            + (errorType != null ? " (" + errorType + ")" : "");
    }
}
