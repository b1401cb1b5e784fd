package com.phillippitts.agentgovernor.exception;

/**
 * Thrown when a penalty or appeal referenced by a caller does not exist,
 * or no longer accepts the requested operation.
 */
public class NotFoundException extends AgentGovernorException {

    private final String resourceType;
    private final String resourceId;

    public NotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public NotFoundException(String resourceType, String resourceId, String detail) {
        super(resourceType + " not found: " + resourceId + " (" + detail + ")");
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
