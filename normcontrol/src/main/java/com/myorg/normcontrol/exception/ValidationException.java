package com.myorg.normcontrol.exception;

/**
 * The caller handed the pipeline input it cannot work with.
 */
public class ValidationException extends NormControlException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorKind() {
        return "validation_error";
    }
}
