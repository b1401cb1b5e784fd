package com.phillippitts.agentgovernor.service.remediation.event;

import java.time.Instant;

/**
 * Published whenever a curriculum stage attempt is closed, passed or not.
 *
 * @param stage       display name of the stage
 * @param attempt     1 for the first attempt, 2 for the retry
 * @param passed      whether the stage requirements were met
 * @param successRate success rate over the attempt's tasks
 */
public record StageCompletedEvent(
        String agentId,
        String sessionId,
        String stage,
        int attempt,
        boolean passed,
        double successRate,
        Instant at
) {}
