package com.phillippitts.agentgovernor.exception;

/**
 * Base exception for all agentgovernor application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AgentGovernorException extends RuntimeException {

    public AgentGovernorException(String message) {
        super(message);
    }

    public AgentGovernorException(String message, Throwable cause) {
        super(message, cause);
    }

    public AgentGovernorException(Throwable cause) {
        super(cause);
    }
}
