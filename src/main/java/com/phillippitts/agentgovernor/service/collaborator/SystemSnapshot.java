package com.phillippitts.agentgovernor.service.collaborator;

/**
 * Point-in-time reading of system health.
 *
 * @param systemLoad         load in [0,1]
 * @param queueBacklog       number of queued tasks
 * @param networkLatencyMs   observed network latency
 * @param busIssues          message bus degraded
 * @param networkIssues      network degraded
 * @param dependencyFailures downstream dependencies failing
 */
public record SystemSnapshot(
        double systemLoad,
        int queueBacklog,
        double networkLatencyMs,
        boolean busIssues,
        boolean networkIssues,
        boolean dependencyFailures
) {

    /** Healthy environment: half load, empty queue, 50 ms latency, no incidents. */
    public static final SystemSnapshot NOMINAL = new SystemSnapshot(0.5, 0, 50.0, false, false, false);
}
