package com.phillippitts.agentgovernor.exception;

/**
 * Thrown when an external collaborator (metrics source, event bus) fails or times out.
 */
public class CollaboratorFailureException extends AgentGovernorException {

    private final String collaborator;

    public CollaboratorFailureException(String message, String collaborator) {
        super(message + " (collaborator: " + collaborator + ")");
        this.collaborator = collaborator;
    }

    public CollaboratorFailureException(String message, String collaborator, Throwable cause) {
        super(message + " (collaborator: " + collaborator + ")", cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
