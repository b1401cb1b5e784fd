package com.phillippitts.agentgovernor.util;

import org.apache.logging.log4j.CloseableThreadContext;

/**
 * MDC keys shared by governance operations. Use in try-with-resources so the keys are
 * removed when the operation ends.
 */
public final class GovernanceLogContext {

    public static final String AGENT_ID = "agentId";
    public static final String OPERATION = "operation";

    private GovernanceLogContext() {}

    public static CloseableThreadContext.Instance forAgent(String agentId, String operation) {
        return CloseableThreadContext.put(AGENT_ID, agentId).put(OPERATION, operation);
    }
}
