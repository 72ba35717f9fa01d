package com.researchplatform.common.exception;

/**
 * Failure reported by an external collaborator (market data, search, portfolio, language model):
 * transport errors, non-2xx statuses, rate-limit bodies or unusable payloads.
 */
public class CollaboratorException extends RuntimeException {
    private final String collaborator;

    public CollaboratorException(String collaborator, String message) {
        super("[" + collaborator + "] " + message);
        this.collaborator = collaborator;
    }

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super("[" + collaborator + "] " + message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
