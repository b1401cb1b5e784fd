package com.phillippitts.agentgovernor.exception;

/**
 * Thrown when an operation is not allowed in the current lifecycle state,
 * e.g. reviewing an appeal that was already resolved.
 */
public class InvalidTransitionException extends AgentGovernorException {

    private final String currentState;

    public InvalidTransitionException(String message, String currentState) {
        super(message + " (state: " + currentState + ")");
        this.currentState = currentState;
    }

    public String getCurrentState() {
        return currentState;
    }
}
