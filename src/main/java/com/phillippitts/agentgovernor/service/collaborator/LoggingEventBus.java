package com.phillippitts.agentgovernor.service.collaborator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.UUID;

/**
 * Local {@link GovernanceEventBus} that writes each message to the log.
 *
 * <p>Registered when no broker-backed bus is present.
 */
public class LoggingEventBus implements GovernanceEventBus {

    private static final Logger LOG = LogManager.getLogger(LoggingEventBus.class);

    @Override
    public String publish(String topic, String eventType, Object payload) {
        String messageId = UUID.randomUUID().toString();
        LOG.info("Bus message {} on {} [{}]: {}", messageId, topic, eventType, payload);
        return messageId;
    }
}
