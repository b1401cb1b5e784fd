package com.phillippitts.agentgovernor.service.collaborator;

import com.phillippitts.agentgovernor.domain.AgentMetrics;

/**
 * Supplies live telemetry for an agent.
 *
 * <p>Implementations may block on I/O. Callers invoke them through
 * {@link CollaboratorGateway}, which applies the configured timeout.
 */
@FunctionalInterface
public interface MetricsSource {

    /**
     * Returns the current metrics snapshot for the agent.
     *
     * @param agentId agent identifier, never {@code null}
     * @return metrics snapshot, never {@code null}
     */
    AgentMetrics getAgentMetrics(String agentId);
}
