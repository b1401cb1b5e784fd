package com.phillippitts.agentgovernor.service.collaborator;

import com.phillippitts.agentgovernor.domain.AgentMetrics;

/**
 * Local {@link MetricsSource} reporting an idle, healthy agent.
 *
 * <p>With no tasks in the window no trigger can fire, so an unconfigured deployment never
 * penalizes anyone.
 */
public class NominalMetricsSource implements MetricsSource {

    @Override
    public AgentMetrics getAgentMetrics(String agentId) {
        return new AgentMetrics(agentId, 0.0, 0.0, 1.0, 1.0, 1.0, 1.0, 1.0, 0.0,
                AgentMetrics.ResourceUsage.IDLE, 0, 0.0);
    }
}
