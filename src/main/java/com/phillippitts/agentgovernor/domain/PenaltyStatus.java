package com.phillippitts.agentgovernor.domain;

import java.util.List;

/**
 * Everything known about one agent's sanctions.
 *
 * @param active          current penalty, or {@code null}
 * @param throttle        throttle snapshot, or {@code null} if the agent was never throttled
 * @param probation       probation period, or {@code null}
 * @param historySize     number of penalties ever applied to the agent
 * @param recentPenalties the last few penalties, oldest first
 */
public record PenaltyStatus(
        Penalty active,
        ThrottleStatus throttle,
        ProbationPeriod probation,
        int historySize,
        List<Penalty> recentPenalties
) {}
