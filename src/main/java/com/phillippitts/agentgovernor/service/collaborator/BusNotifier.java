package com.phillippitts.agentgovernor.service.collaborator;

import com.phillippitts.agentgovernor.exception.CollaboratorFailureException;
import com.phillippitts.agentgovernor.service.metrics.GovernanceMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Best-effort outbound notifications.
 *
 * <p>Callers notify after their state change is committed; a delivery failure is logged and
 * counted and never propagates, so it cannot roll that change back.
 */
public class BusNotifier {

    private static final Logger LOG = LogManager.getLogger(BusNotifier.class);

    public static final String PENALTIES_TOPIC = "agent.penalties";
    public static final String RETRAINING_TOPIC = "agent.retraining";

    private final CollaboratorGateway gateway;
    private final GovernanceMetrics metrics;

    public BusNotifier(CollaboratorGateway gateway, GovernanceMetrics metrics) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Publishes a message, swallowing delivery failures.
     *
     * @return the message id, or empty when delivery failed
     */
    public Optional<String> notify(String topic, String routingKey, Object payload) {
        try {
            return Optional.ofNullable(gateway.publish(topic, routingKey, payload));
        } catch (CollaboratorFailureException e) {
            LOG.warn("Could not publish {} on {}: {}", routingKey, topic, e.getMessage());
            metrics.incrementPublishFailure(topic);
            return Optional.empty();
        } catch (RuntimeException e) {
            LOG.warn("Unexpected error publishing {} on {}", routingKey, topic, e);
            metrics.incrementPublishFailure(topic);
            return Optional.empty();
        }
    }
}
