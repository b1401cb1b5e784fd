package com.phillippitts.agentgovernor.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Targets an agent must meet, all at once, before its penalty is lifted.
 *
 * @param targetMetrics       metric to threshold; lower-is-better metrics must be at or below,
 *                            higher-is-better metrics at or above
 * @param requiredImprovement relative improvement expected over the penalty window
 * @param checkpoints         times at which progress is reviewed
 * @param retrainingRequired  whether any trigger was severe enough to call for retraining
 */
public record ImprovementPlan(
        Map<TargetMetric, Double> targetMetrics,
        double requiredImprovement,
        List<Instant> checkpoints,
        boolean retrainingRequired
) {

    public ImprovementPlan {
        targetMetrics = targetMetrics.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(targetMetrics));
        checkpoints = List.copyOf(checkpoints);
    }

    /**
     * Lists the targets the given metrics still fail.
     */
    public List<TargetMetric> unmetTargets(AgentMetrics current) {
        List<TargetMetric> unmet = new ArrayList<>();
        for (Map.Entry<TargetMetric, Double> entry : targetMetrics.entrySet()) {
            TargetMetric metric = entry.getKey();
            if (!metric.isMet(metric.read(current), entry.getValue())) {
                unmet.add(metric);
            }
        }
        return unmet;
    }

    /** True only when every target is met. */
    public boolean isSatisfiedBy(AgentMetrics current) {
        return unmetTargets(current).isEmpty();
    }
}
