package com.myorg.normcontrol.exception;

/**
 * An internal-consistency check failed (for example a section with {@code end < start}).
 * Always fatal for the current run; the offending data is never corrected silently.
 */
public class InternalPipelineException extends NormControlException {

    public InternalPipelineException(String message) {
        super(message);
    }

    public InternalPipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorKind() {
        return "internal_pipeline_error";
    }
}
