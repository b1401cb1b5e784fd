package com.phillippitts.agentgovernor.service.remediation;

import java.time.Duration;

/**
 * Fleet-wide retraining outcomes.
 *
 * @param completed       sessions that ended, graduated or failed
 * @param graduationRate  successful divided by completed; 0 when nothing completed
 * @param averageDuration mean duration of completed sessions
 */
public record RemediationStatistics(
        int active,
        int completed,
        int successful,
        int failed,
        double graduationRate,
        Duration averageDuration
) {}
