package com.phillippitts.agentgovernor.service.collaborator;

import com.phillippitts.agentgovernor.config.properties.GovernanceProperties;
import com.phillippitts.agentgovernor.domain.AgentMetrics;
import com.phillippitts.agentgovernor.exception.CollaboratorFailureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls to external collaborators on the governance executor with a timeout.
 *
 * <p>Every failure mode (exception, timeout, interruption) surfaces as a
 * {@link CollaboratorFailureException} naming the collaborator.
 */
public class CollaboratorGateway {

    private static final Logger LOG = LogManager.getLogger(CollaboratorGateway.class);

    public static final String METRICS_SOURCE = "metrics-source";
    public static final String EVENT_BUS = "event-bus";

    private final MetricsSource metricsSource;
    private final GovernanceEventBus eventBus;
    private final Executor executor;
    private final long metricsTimeoutMs;
    private final long publishTimeoutMs;

    public CollaboratorGateway(MetricsSource metricsSource,
                               GovernanceEventBus eventBus,
                               Executor executor,
                               GovernanceProperties properties) {
        this.metricsSource = Objects.requireNonNull(metricsSource, "metricsSource");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metricsTimeoutMs = properties.getCollaborators().getMetricsTimeoutMs();
        this.publishTimeoutMs = properties.getCollaborators().getPublishTimeoutMs();
    }

    /**
     * Fetches live metrics for an agent.
     *
     * @throws CollaboratorFailureException if the source fails, times out or returns nothing
     */
    public AgentMetrics fetchMetrics(String agentId) {
        AgentMetrics metrics = call(METRICS_SOURCE, metricsTimeoutMs,
                () -> metricsSource.getAgentMetrics(agentId));
        if (metrics == null) {
            throw new CollaboratorFailureException("No metrics returned for agent " + agentId, METRICS_SOURCE);
        }
        return metrics;
    }

    /**
     * Publishes a message on the bus.
     *
     * @return message id
     * @throws CollaboratorFailureException if the bus fails or times out
     */
    public String publish(String topic, String eventType, Object payload) {
        return call(EVENT_BUS, publishTimeoutMs, () -> eventBus.publish(topic, eventType, payload));
    }

    private <T> T call(String collaborator, long timeoutMs, Supplier<T> work) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(work, executor);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            LOG.warn("Call to {} timed out after {} ms", collaborator, timeoutMs);
            throw new CollaboratorFailureException("Timed out after " + timeoutMs + " ms", collaborator, te);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CollaboratorFailureException("Interrupted while waiting", collaborator, ie);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause() != null ? ee.getCause() : ee;
            throw new CollaboratorFailureException(String.valueOf(cause.getMessage()), collaborator, cause);
        }
    }
}
