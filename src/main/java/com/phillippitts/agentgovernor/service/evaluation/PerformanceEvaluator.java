package com.phillippitts.agentgovernor.service.evaluation;

import com.phillippitts.agentgovernor.config.properties.GovernanceProperties;
import com.phillippitts.agentgovernor.domain.AgentMetrics;
import com.phillippitts.agentgovernor.domain.AnomalyReport;
import com.phillippitts.agentgovernor.domain.Appeal;
import com.phillippitts.agentgovernor.domain.AppealStatus;
import com.phillippitts.agentgovernor.domain.EvaluationContext;
import com.phillippitts.agentgovernor.domain.FairnessMetrics;
import com.phillippitts.agentgovernor.domain.Penalty;
import com.phillippitts.agentgovernor.domain.PenaltyLevel;
import com.phillippitts.agentgovernor.domain.ResourceAllocation;
import com.phillippitts.agentgovernor.domain.Trigger;
import com.phillippitts.agentgovernor.domain.TriggerType;
import com.phillippitts.agentgovernor.service.collaborator.SystemConditionsProvider;
import com.phillippitts.agentgovernor.service.collaborator.SystemSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns raw agent telemetry into triggers, a penalty level and a fairness assessment.
 *
 * <p>Safeguards applied before a penalty is proposed:
 * <ul>
 *   <li><b>Minimum samples:</b> no trigger fires below {@code governance.triggers.min-samples} tasks</li>
 *   <li><b>Context:</b> high load, strong history and network trouble each lower the level one step</li>
 *   <li><b>Latency exclusion:</b> timeouts are ignored while the system reports high latency</li>
 *   <li><b>Normal variance:</b> a quality drop or resource spike that is within the agent's own
 *       recent spread is not treated as a violation</li>
 *   <li><b>Anomaly review:</b> suspicious penalties are flagged for automatic review</li>
 * </ul>
 *
 * <p>Thread-safe: holds no per-call state apart from {@link MetricsHistory}, which locks per agent.
 */
public class PerformanceEvaluator {

    private static final Logger LOG = LogManager.getLogger(PerformanceEvaluator.class);

    /** Severity assumed for each trigger when only the trigger types are known. */
    private static final int ASSUMED_TRIGGER_SEVERITY = 3;

    private static final double WEIGHT_DISPROPORTIONATE = 0.30;
    private static final double WEIGHT_ENVIRONMENTAL = 0.25;
    private static final double WEIGHT_SYSTEM_STRESS = 0.20;
    private static final double WEIGHT_SUDDEN_DROP = 0.25;

    private static final double FALSE_POSITIVE_TOLERANCE = 0.10;
    private static final double APPEAL_SUCCESS_TOLERANCE = 0.40;

    private static final SeverityBands ERROR_BANDS = new SeverityBands(new double[]{0.15, 0.25, 0.40}, new int[]{1, 2, 3}, 4);
    private static final SeverityBands TIMEOUT_BANDS = new SeverityBands(new double[]{0.30, 0.45, 0.60}, new int[]{1, 2, 3}, 4);
    private static final SeverityBands QUALITY_BANDS = new SeverityBands(new double[]{0.20, 0.30, 0.45}, new int[]{1, 2, 3}, 4);
    private static final SeverityBands COLLABORATION_BANDS = new SeverityBands(new double[]{0.40, 0.55, 0.70}, new int[]{1, 2, 3}, 4);
    private static final SeverityBands RESOURCE_BANDS = new SeverityBands(new double[]{1.7, 2.0, 3.0}, new int[]{2, 3, 4}, 5);

    private final GovernanceProperties.Triggers triggers;
    private final GovernanceProperties.Evaluator settings;
    private final GovernanceProperties.MinimumResources minimumResources;
    private final SystemConditionsProvider conditionsProvider;
    private final MetricsHistory history;
    private final Clock clock;

    public PerformanceEvaluator(GovernanceProperties properties,
                                SystemConditionsProvider conditionsProvider,
                                MetricsHistory history,
                                Clock clock) {
        Objects.requireNonNull(properties, "properties");
        this.triggers = properties.getTriggers();
        this.settings = properties.getEvaluator();
        this.minimumResources = properties.getMinimumResources();
        this.conditionsProvider = Objects.requireNonNull(conditionsProvider, "conditionsProvider");
        this.history = Objects.requireNonNull(history, "history");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Builds the situational context for an evaluation.
     *
     * <p>The agent state reflects readings recorded before this call; the current reading is
     * appended to the history afterwards so the next evaluation sees it.
     */
    public EvaluationContext analyzeContext(String agentId, AgentMetrics metrics) {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(metrics, "metrics");

        SystemSnapshot snapshot = conditionsProvider.currentConditions();
        if (snapshot == null) {
            snapshot = SystemSnapshot.NOMINAL;
        }

        double difficulty = clamp(metrics.avgResponseTime() / (2.0 * settings.getReferenceResponseTimeMs()), 0.0, 1.0);
        EvaluationContext.TaskDifficulty taskDifficulty =
                new EvaluationContext.TaskDifficulty(difficulty, difficulty > 0.5);

        EvaluationContext.SystemConditions conditions = new EvaluationContext.SystemConditions(
                snapshot.systemLoad(),
                snapshot.queueBacklog(),
                snapshot.networkLatencyMs(),
                snapshot.networkLatencyMs() > settings.getHighLatencyMs());

        List<MetricsHistory.Reading> earlier = history.readings(agentId);
        List<Double> quality = new ArrayList<>(earlier.size());
        List<Double> peaks = new ArrayList<>(earlier.size());
        List<Double> success = new ArrayList<>(earlier.size());
        for (MetricsHistory.Reading r : earlier) {
            quality.add(r.quality());
            peaks.add(r.resourcePeak());
            success.add(r.successRate());
        }
        double historical = success.isEmpty() ? metrics.successRate() : Statistics.mean(success);
        EvaluationContext.AgentState state = new EvaluationContext.AgentState(historical, quality, peaks);

        EvaluationContext.ExternalFactors external = new EvaluationContext.ExternalFactors(
                snapshot.busIssues(), snapshot.networkIssues(), snapshot.dependencyFailures());

        history.record(metrics);
        return new EvaluationContext(agentId, metrics, taskDifficulty, conditions, state, external, clock.instant());
    }

    /** Drops the metric readings kept for an agent that left the fleet. */
    public void forgetAgent(String agentId) {
        history.clear(agentId);
    }

    /**
     * Compares metrics to thresholds.
     *
     * @return triggers in detection order; empty below the minimum sample size
     */
    public List<Trigger> evaluateTriggers(AgentMetrics metrics, EvaluationContext context) {
        if (metrics.taskCount() < triggers.getMinSamples()) {
            LOG.debug("Skipping trigger evaluation for {}: {} tasks < {} required",
                    metrics.agentId(), metrics.taskCount(), triggers.getMinSamples());
            return List.of();
        }

        List<Trigger> found = new ArrayList<>();

        double errorThreshold = triggers.getErrorRateThreshold();
        if (metrics.errorRate() > errorThreshold) {
            found.add(new Trigger(TriggerType.ERROR_RATE, metrics.errorRate(), errorThreshold,
                    ERROR_BANDS.severityOf(metrics.errorRate())));
        }

        double timeoutThreshold = triggers.getTimeoutRateThreshold();
        if (metrics.timeoutRate() > timeoutThreshold) {
            if (context.systemConditions().highLatency()) {
                LOG.debug("Ignoring timeout rate {} for {} during high latency",
                        metrics.timeoutRate(), metrics.agentId());
            } else {
                found.add(new Trigger(TriggerType.TIMEOUT_FREQUENCY, metrics.timeoutRate(), timeoutThreshold,
                        TIMEOUT_BANDS.severityOf(metrics.timeoutRate())));
            }
        }

        double dropThreshold = triggers.getQualityDropThreshold();
        double drop = metrics.qualityDrop();
        if (drop > dropThreshold) {
            List<Double> recent = context.agentState().recentQuality();
            double meanDrop = metrics.baselineQuality() > 0.0
                    ? (metrics.baselineQuality() - Statistics.mean(recent)) / metrics.baselineQuality()
                    : 0.0;
            if (withinNormalVariance(metrics.currentQuality(), recent, meanDrop <= dropThreshold)) {
                LOG.debug("Quality drop {} for {} is within normal variance", drop, metrics.agentId());
            } else {
                found.add(new Trigger(TriggerType.QUALITY_DROP, drop, dropThreshold, QUALITY_BANDS.severityOf(drop)));
            }
        }

        double collaborationThreshold = triggers.getCollaborationFailureThreshold();
        if (metrics.collaborationFailureRate() > collaborationThreshold) {
            found.add(new Trigger(TriggerType.COLLABORATION_FAILURE, metrics.collaborationFailureRate(),
                    collaborationThreshold, COLLABORATION_BANDS.severityOf(metrics.collaborationFailureRate())));
        }

        double resourceThreshold = triggers.getResourceAbuseThreshold();
        double peak = metrics.resourceUsage().peak();
        if (peak > resourceThreshold) {
            List<Double> recent = context.agentState().recentResourcePeak();
            if (withinNormalVariance(peak, recent, Statistics.mean(recent) <= resourceThreshold)) {
                LOG.debug("Resource peak {} for {} is within normal variance", peak, metrics.agentId());
            } else {
                found.add(new Trigger(TriggerType.RESOURCE_ABUSE, peak, resourceThreshold, RESOURCE_BANDS.severityOf(peak)));
            }
        }

        return found;
    }

    /**
     * Maps triggers to a penalty level: the highest severity plus one step for every
     * additional trigger, lowered one step each for high load, strong history and network
     * issues, clamped to 1..6.
     *
     * @return 0 when there are no triggers
     */
    public int determinePenaltyLevel(List<Trigger> found, EvaluationContext context) {
        if (found == null || found.isEmpty()) {
            return 0;
        }
        int maxSeverity = found.stream().mapToInt(Trigger::severity).max().orElse(1);
        int level = maxSeverity + (found.size() - 1);

        if (context.systemConditions().systemLoad() > settings.getHighLoadThreshold()) {
            level--;
        }
        if (context.agentState().historicalPerformance() > settings.getStrongHistoryThreshold()) {
            level--;
        }
        if (context.externalFactors().networkIssues()) {
            level--;
        }
        return clamp(level, PenaltyLevel.MIN, PenaltyLevel.MAX);
    }

    /**
     * Checks a penalty for signs it may be unfair, assuming mid-range trigger severities.
     */
    public AnomalyReport detectAnomalies(Penalty penalty, EvaluationContext context) {
        return detectAnomalies(penalty, ASSUMED_TRIGGER_SEVERITY, context);
    }

    /**
     * Checks a penalty for signs it may be unfair using the severities of the triggers that
     * produced it.
     */
    public AnomalyReport detectAnomalies(Penalty penalty, List<Trigger> found, EvaluationContext context) {
        int maxSeverity = found.stream().mapToInt(Trigger::severity).max().orElse(ASSUMED_TRIGGER_SEVERITY);
        return detectAnomalies(penalty, maxSeverity, context);
    }

    private AnomalyReport detectAnomalies(Penalty penalty, int maxSeverity, EvaluationContext context) {
        int level = penalty.level().level();
        boolean disproportionate = level >= 5 && level > maxSeverity + 2;
        boolean environmental = isEnvironmentalAnomaly(context);
        boolean stress = context.systemConditions().systemLoad() > settings.getHighLoadThreshold();
        boolean suddenDrop = penalty.metricsAtStart().qualityDrop() > settings.getSuddenDropThreshold();

        AnomalyReport.Anomalies anomalies = new AnomalyReport.Anomalies(disproportionate, environmental, stress, suddenDrop);
        double score = (disproportionate ? WEIGHT_DISPROPORTIONATE : 0.0)
                + (environmental ? WEIGHT_ENVIRONMENTAL : 0.0)
                + (stress ? WEIGHT_SYSTEM_STRESS : 0.0)
                + (suddenDrop ? WEIGHT_SUDDEN_DROP : 0.0);
        boolean autoReview = score > settings.getAutoReviewScore() || (level >= 5 && environmental);

        return new AnomalyReport(anomalies, score, autoReview, recommend(anomalies));
    }

    /** z-score outlier test using the configured threshold. */
    public boolean isOutlier(double value, Collection<Double> population) {
        return Statistics.isOutlier(value, population, settings.getZScoreThreshold());
    }

    /** Raises each dimension of an allocation to its guaranteed floor. */
    public ResourceAllocation validateMinimumResources(ResourceAllocation allocation) {
        return new ResourceAllocation(
                Math.max(allocation.cpu(), minimumResources.getCpu()),
                Math.max(allocation.memory(), minimumResources.getMemory()),
                Math.max(allocation.network(), minimumResources.getNetwork()),
                Math.max(allocation.taskRate(), minimumResources.getTaskRate()));
    }

    /**
     * Fleet fairness: approved appeals are treated as false positives. The score starts at
     * 100 and loses points when the false-positive rate exceeds 10% or the appeal success
     * rate exceeds 40%.
     */
    public FairnessMetrics getFairnessMetrics(Collection<Penalty> penalties, Collection<Appeal> appeals) {
        return getFairnessMetrics(penalties.size(), appeals);
    }

    /**
     * Fleet fairness from a running count of penalties rather than the penalties themselves.
     */
    public FairnessMetrics getFairnessMetrics(int totalPenalties, Collection<Appeal> appeals) {
        int totalAppeals = appeals.size();
        int approved = (int) appeals.stream().filter(a -> a.status() == AppealStatus.APPROVED).count();

        double falsePositiveRate = totalPenalties > 0 ? (double) approved / totalPenalties : 0.0;
        double appealSuccessRate = totalAppeals > 0 ? (double) approved / totalAppeals : 0.0;

        double score = 100.0;
        if (falsePositiveRate > FALSE_POSITIVE_TOLERANCE) {
            score -= (falsePositiveRate - FALSE_POSITIVE_TOLERANCE) * 200.0;
        }
        if (appealSuccessRate > APPEAL_SUCCESS_TOLERANCE) {
            score -= (appealSuccessRate - APPEAL_SUCCESS_TOLERANCE) * 100.0;
        }
        return new FairnessMetrics(totalPenalties, totalAppeals, approved, falsePositiveRate, appealSuccessRate,
                clamp(score, 0.0, 100.0));
    }

    /**
     * Human-readable summary, one clause per trigger joined with {@code "; "}.
     */
    public static String generateReason(List<Trigger> found) {
        return found.stream().map(PerformanceEvaluator::describe).collect(Collectors.joining("; "));
    }

    private static String describe(Trigger t) {
        return switch (t.type()) {
            case ERROR_RATE -> String.format(Locale.ROOT, "Error rate (%s) exceeds threshold (%s)",
                    percent(t.value(), 1), percent(t.threshold(), 0));
            case TIMEOUT_FREQUENCY -> String.format(Locale.ROOT, "Timeout rate (%s) exceeds threshold (%s)",
                    percent(t.value(), 1), percent(t.threshold(), 0));
            case QUALITY_DROP -> String.format(Locale.ROOT, "Quality dropped by %s (threshold %s)",
                    percent(t.value(), 1), percent(t.threshold(), 0));
            case COLLABORATION_FAILURE -> String.format(Locale.ROOT, "Collaboration failure rate (%s) exceeds threshold (%s)",
                    percent(t.value(), 1), percent(t.threshold(), 0));
            case RESOURCE_ABUSE -> String.format(Locale.ROOT, "Resource usage (%.2fx allocation) exceeds threshold (%.2fx)",
                    t.value(), t.threshold());
        };
    }

    private static String percent(double ratio, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f%%", ratio * 100.0);
    }

    private boolean isEnvironmentalAnomaly(EvaluationContext context) {
        int factors = 0;
        if (context.systemConditions().systemLoad() > settings.getHighLoadThreshold()) {
            factors++;
        }
        if (context.externalFactors().networkIssues()) {
            factors++;
        }
        if (context.externalFactors().busIssues()) {
            factors++;
        }
        if (context.externalFactors().dependencyFailures()) {
            factors++;
        }
        return factors >= 2;
    }

    /**
     * A reading counts as normal variance only with enough history, when it is not an outlier
     * against that history and the history itself was acceptable.
     */
    private boolean withinNormalVariance(double value, List<Double> recent, boolean historyAcceptable) {
        return recent.size() >= settings.getMinPopulation()
                && historyAcceptable
                && !isOutlier(value, recent);
    }

    private static String recommend(AnomalyReport.Anomalies anomalies) {
        List<String> advice = new ArrayList<>();
        if (anomalies.disproportionatePenalty()) {
            advice.add("Penalty may be disproportionate, consider reducing the level");
        }
        if (anomalies.environmentalAnomaly()) {
            advice.add("Environmental factors detected, may not be the agent's fault");
        }
        if (anomalies.systemStress()) {
            advice.add("System under stress, degradation expected");
        }
        if (anomalies.suddenPerformanceDrop()) {
            advice.add("Sudden drop detected, investigate external causes");
        }
        return advice.isEmpty() ? "No anomalies detected" : String.join("; ", advice);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Upper bounds (inclusive) with the severity assigned to each band.
     */
    private record SeverityBands(double[] upperBounds, int[] severities, int beyond) {

        int severityOf(double value) {
            for (int i = 0; i < upperBounds.length; i++) {
                if (value <= upperBounds[i]) {
                    return severities[i];
                }
            }
            return beyond;
        }
    }
}
