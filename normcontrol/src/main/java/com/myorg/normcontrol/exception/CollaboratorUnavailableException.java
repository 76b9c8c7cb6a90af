package com.myorg.normcontrol.exception;

import lombok.Getter;

/**
 * An external collaborator (text extraction, document store) failed. Callers may retry at
 * that collaborator instead of re-running the whole analysis.
 */
@Getter
public class CollaboratorUnavailableException extends NormControlException {

    private final String collaborator;

    public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
        super(collaborator + ": " + message, cause);
        this.collaborator = collaborator;
    }

    @Override
    public String getErrorKind() {
        return "collaborator_unavailable";
    }
}
