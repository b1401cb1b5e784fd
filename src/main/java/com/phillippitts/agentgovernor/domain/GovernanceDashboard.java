package com.phillippitts.agentgovernor.domain;

import java.util.List;
import java.util.Map;

/**
 * Fleet-wide aggregate. Built from a point-in-time snapshot, so counts may lag concurrent writers.
 *
 * @param byLevel keys {@code level1}..{@code level6}
 */
public record GovernanceDashboard(
        int totalPenalties,
        Map<String, Integer> byLevel,
        AppealSummary appeals,
        ProbationSummary probation,
        RetrainingSummary retraining
) {

    public record AppealSummary(int pending, int approved, int denied, int total, double approvalRate) {}

    public record ProbationSummary(int count, List<String> agents) {}

    public record RetrainingSummary(int active, int completed, double graduationRate) {}
}
