package com.phillippitts.agentgovernor.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Heightened monitoring after an agent graduates from remediation.
 */
public record ProbationPeriod(
        String agentId,
        Instant startedAt,
        Instant endsAt,
        Duration duration,
        double minimumSuccessRate,
        double maximumErrorRate,
        double qualityThreshold
) {}
