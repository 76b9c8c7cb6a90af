package com.myorg.normcontrol.exception;

/**
 * Base type for every error the analysis pipeline lets escape to its caller.
 */
public abstract class NormControlException extends RuntimeException {

    protected NormControlException(String message) {
        super(message);
    }

    protected NormControlException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable kind, echoed in error responses.
     */
    public abstract String getErrorKind();
}
