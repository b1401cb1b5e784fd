package com.phillippitts.agentgovernor.service.collaborator;

/**
 * Outbound message bus for governance notifications consumed by other services.
 */
@FunctionalInterface
public interface GovernanceEventBus {

    /**
     * Publishes a payload under a topic and routing key.
     *
     * @param topic     logical topic, e.g. {@code agent.penalties}
     * @param eventType routing key, e.g. {@code penalty.applied.level2.agent-7}
     * @param payload   message body, serialized by the implementation
     * @return message id assigned by the bus
     */
    String publish(String topic, String eventType, Object payload);
}
