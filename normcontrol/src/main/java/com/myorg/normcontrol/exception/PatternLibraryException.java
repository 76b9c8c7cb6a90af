package com.myorg.normcontrol.exception;

/**
 * The pattern library resource is missing or malformed.
 */
public class PatternLibraryException extends NormControlException {

    public PatternLibraryException(String message) {
        super(message);
    }

    public PatternLibraryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorKind() {
        return "pattern_library_error";
    }
}
