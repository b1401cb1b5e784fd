package com.phillippitts.agentgovernor.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the governance engine.
 *
 * <p>Every threshold the evaluator, throttle and lifecycle controller compare against lives
 * here so it can be tuned in application.properties without touching control flow.
 */
@ConfigurationProperties(prefix = "governance")
@Validated
public class GovernanceProperties {

    @Valid
    private Triggers triggers = new Triggers();

    @Valid
    private Evaluator evaluator = new Evaluator();

    @Valid
    private MinimumResources minimumResources = new MinimumResources();

    @Valid
    private Targets targets = new Targets();

    @Valid
    private Throttle throttle = new Throttle();

    @Valid
    private Remediation remediation = new Remediation();

    @Valid
    private Appeals appeals = new Appeals();

    @Valid
    private Probation probation = new Probation();

    @Valid
    private Collaborators collaborators = new Collaborators();

    @Valid
    private Schedule schedule = new Schedule();

    public Triggers getTriggers() {
        return triggers;
    }

    public void setTriggers(Triggers triggers) {
        this.triggers = triggers;
    }

    public Evaluator getEvaluator() {
        return evaluator;
    }

    public void setEvaluator(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    public MinimumResources getMinimumResources() {
        return minimumResources;
    }

    public void setMinimumResources(MinimumResources minimumResources) {
        this.minimumResources = minimumResources;
    }

    public Targets getTargets() {
        return targets;
    }

    public void setTargets(Targets targets) {
        this.targets = targets;
    }

    public Throttle getThrottle() {
        return throttle;
    }

    public void setThrottle(Throttle throttle) {
        this.throttle = throttle;
    }

    public Remediation getRemediation() {
        return remediation;
    }

    public void setRemediation(Remediation remediation) {
        this.remediation = remediation;
    }

    public Appeals getAppeals() {
        return appeals;
    }

    public void setAppeals(Appeals appeals) {
        this.appeals = appeals;
    }

    public Probation getProbation() {
        return probation;
    }

    public void setProbation(Probation probation) {
        this.probation = probation;
    }

    public Collaborators getCollaborators() {
        return collaborators;
    }

    public void setCollaborators(Collaborators collaborators) {
        this.collaborators = collaborators;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    /**
     * Trigger thresholds and the minimum sample size required before any penalty.
     */
    public static class Triggers {
        /** Tasks required in the window before triggers are evaluated. */
        @Positive(message = "Minimum samples must be positive")
        private int minSamples = 10;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double errorRateThreshold = 0.10;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double timeoutRateThreshold = 0.20;

        /** Relative drop from baseline quality that fires a quality trigger. */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double qualityDropThreshold = 0.20;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double collaborationFailureThreshold = 0.30;

        /** Usage ratio relative to allocation; must exceed full allocation. */
        @DecimalMin(value = "1.0", inclusive = false)
        private double resourceAbuseThreshold = 1.5;

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public double getErrorRateThreshold() {
            return errorRateThreshold;
        }

        public void setErrorRateThreshold(double errorRateThreshold) {
            this.errorRateThreshold = errorRateThreshold;
        }

        public double getTimeoutRateThreshold() {
            return timeoutRateThreshold;
        }

        public void setTimeoutRateThreshold(double timeoutRateThreshold) {
            this.timeoutRateThreshold = timeoutRateThreshold;
        }

        public double getQualityDropThreshold() {
            return qualityDropThreshold;
        }

        public void setQualityDropThreshold(double qualityDropThreshold) {
            this.qualityDropThreshold = qualityDropThreshold;
        }

        public double getCollaborationFailureThreshold() {
            return collaborationFailureThreshold;
        }

        public void setCollaborationFailureThreshold(double collaborationFailureThreshold) {
            this.collaborationFailureThreshold = collaborationFailureThreshold;
        }

        public double getResourceAbuseThreshold() {
            return resourceAbuseThreshold;
        }

        public void setResourceAbuseThreshold(double resourceAbuseThreshold) {
            this.resourceAbuseThreshold = resourceAbuseThreshold;
        }
    }

    /**
     * Context, anomaly and outlier tuning.
     */
    public static class Evaluator {
        @DecimalMin(value = "0.0", inclusive = false)
        private double zScoreThreshold = 2.0;

        /** Anomaly score above which a penalty is sent to review automatically. */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double autoReviewScore = 0.7;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double suddenDropThreshold = 0.30;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double highLoadThreshold = 0.8;

        @Positive
        private double highLatencyMs = 500.0;

        /** Historical success rate above which the penalty level is eased by one step. */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double strongHistoryThreshold = 0.90;

        /** Response time that corresponds to a task difficulty of 0.5. */
        @Positive
        private double referenceResponseTimeMs = 1000.0;

        /** Number of past evaluations kept per agent for outlier checks. */
        @Positive
        private int historyWindow = 20;

        /** History needed before outlier checks can suppress a trigger. */
        @Min(2)
        private int minPopulation = 5;

        public double getZScoreThreshold() {
            return zScoreThreshold;
        }

        public void setZScoreThreshold(double zScoreThreshold) {
            this.zScoreThreshold = zScoreThreshold;
        }

        public double getAutoReviewScore() {
            return autoReviewScore;
        }

        public void setAutoReviewScore(double autoReviewScore) {
            this.autoReviewScore = autoReviewScore;
        }

        public double getSuddenDropThreshold() {
            return suddenDropThreshold;
        }

        public void setSuddenDropThreshold(double suddenDropThreshold) {
            this.suddenDropThreshold = suddenDropThreshold;
        }

        public double getHighLoadThreshold() {
            return highLoadThreshold;
        }

        public void setHighLoadThreshold(double highLoadThreshold) {
            this.highLoadThreshold = highLoadThreshold;
        }

        public double getHighLatencyMs() {
            return highLatencyMs;
        }

        public void setHighLatencyMs(double highLatencyMs) {
            this.highLatencyMs = highLatencyMs;
        }

        public double getStrongHistoryThreshold() {
            return strongHistoryThreshold;
        }

        public void setStrongHistoryThreshold(double strongHistoryThreshold) {
            this.strongHistoryThreshold = strongHistoryThreshold;
        }

        public double getReferenceResponseTimeMs() {
            return referenceResponseTimeMs;
        }

        public void setReferenceResponseTimeMs(double referenceResponseTimeMs) {
            this.referenceResponseTimeMs = referenceResponseTimeMs;
        }

        public int getHistoryWindow() {
            return historyWindow;
        }

        public void setHistoryWindow(int historyWindow) {
            this.historyWindow = historyWindow;
        }

        public int getMinPopulation() {
            return minPopulation;
        }

        public void setMinPopulation(int minPopulation) {
            this.minPopulation = minPopulation;
        }
    }

    /**
     * Floors no penalty may push an allocation below.
     */
    public static class MinimumResources {
        @DecimalMin("0.0")
        private double cpu = 0.1;

        @DecimalMin("0.0")
        private double memory = 0.2;

        @DecimalMin("0.0")
        private double network = 0.3;

        @DecimalMin("0.0")
        private double taskRate = 0.1;

        public double getCpu() {
            return cpu;
        }

        public void setCpu(double cpu) {
            this.cpu = cpu;
        }

        public double getMemory() {
            return memory;
        }

        public void setMemory(double memory) {
            this.memory = memory;
        }

        public double getNetwork() {
            return network;
        }

        public void setNetwork(double network) {
            this.network = network;
        }

        public double getTaskRate() {
            return taskRate;
        }

        public void setTaskRate(double taskRate) {
            this.taskRate = taskRate;
        }
    }

    /**
     * Recovery targets, each strictly better than the matching trigger threshold.
     */
    public static class Targets {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double errorRate = 0.05;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double timeoutRate = 0.10;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double qualityScore = 0.85;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double collaborationSuccessRate = 0.80;

        @DecimalMin(value = "0.0", inclusive = false)
        private double resourceUsage = 1.0;

        public double getErrorRate() {
            return errorRate;
        }

        public void setErrorRate(double errorRate) {
            this.errorRate = errorRate;
        }

        public double getTimeoutRate() {
            return timeoutRate;
        }

        public void setTimeoutRate(double timeoutRate) {
            this.timeoutRate = timeoutRate;
        }

        public double getQualityScore() {
            return qualityScore;
        }

        public void setQualityScore(double qualityScore) {
            this.qualityScore = qualityScore;
        }

        public double getCollaborationSuccessRate() {
            return collaborationSuccessRate;
        }

        public void setCollaborationSuccessRate(double collaborationSuccessRate) {
            this.collaborationSuccessRate = collaborationSuccessRate;
        }

        public double getResourceUsage() {
            return resourceUsage;
        }

        public void setResourceUsage(double resourceUsage) {
            this.resourceUsage = resourceUsage;
        }
    }

    /**
     * Token bucket sizing and penalty scaling.
     */
    public static class Throttle {
        @Positive
        private double capacity = 100.0;

        /** Tokens per second before penalty scaling. */
        @Positive
        private double refillRate = 10.0;

        /** Refill reduction per severity step beyond the first. */
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double multiplierStep = 0.1;

        /** Lowest multiplier; keeps a throttled agent from starving. */
        @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0")
        private double multiplierFloor = 0.1;

        public double getCapacity() {
            return capacity;
        }

        public void setCapacity(double capacity) {
            this.capacity = capacity;
        }

        public double getRefillRate() {
            return refillRate;
        }

        public void setRefillRate(double refillRate) {
            this.refillRate = refillRate;
        }

        public double getMultiplierStep() {
            return multiplierStep;
        }

        public void setMultiplierStep(double multiplierStep) {
            this.multiplierStep = multiplierStep;
        }

        public double getMultiplierFloor() {
            return multiplierFloor;
        }

        public void setMultiplierFloor(double multiplierFloor) {
            this.multiplierFloor = multiplierFloor;
        }
    }

    /**
     * Curriculum graduation policy.
     */
    public static class Remediation {
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double minimumGraduationScore = 0.85;

        /** Attempts allowed per stage before the session fails. */
        @Positive
        private int maxStageAttempts = 2;

        /** Require the configured minimum time in a stage before it can pass. */
        private boolean enforceMinimumStageTime = true;

        public double getMinimumGraduationScore() {
            return minimumGraduationScore;
        }

        public void setMinimumGraduationScore(double minimumGraduationScore) {
            this.minimumGraduationScore = minimumGraduationScore;
        }

        public int getMaxStageAttempts() {
            return maxStageAttempts;
        }

        public void setMaxStageAttempts(int maxStageAttempts) {
            this.maxStageAttempts = maxStageAttempts;
        }

        public boolean isEnforceMinimumStageTime() {
            return enforceMinimumStageTime;
        }

        public void setEnforceMinimumStageTime(boolean enforceMinimumStageTime) {
            this.enforceMinimumStageTime = enforceMinimumStageTime;
        }
    }

    /**
     * Appeal filing window.
     */
    public static class Appeals {
        @Positive(message = "Appeal window must be positive")
        private int windowMinutes = 60;

        public int getWindowMinutes() {
            return windowMinutes;
        }

        public void setWindowMinutes(int windowMinutes) {
            this.windowMinutes = windowMinutes;
        }
    }

    /**
     * Monitoring period after remediation graduation.
     */
    public static class Probation {
        @Positive
        private int durationMinutes = 240;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double minimumSuccessRate = 0.90;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double maximumErrorRate = 0.05;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double qualityThreshold = 0.85;

        public int getDurationMinutes() {
            return durationMinutes;
        }

        public void setDurationMinutes(int durationMinutes) {
            this.durationMinutes = durationMinutes;
        }

        public double getMinimumSuccessRate() {
            return minimumSuccessRate;
        }

        public void setMinimumSuccessRate(double minimumSuccessRate) {
            this.minimumSuccessRate = minimumSuccessRate;
        }

        public double getMaximumErrorRate() {
            return maximumErrorRate;
        }

        public void setMaximumErrorRate(double maximumErrorRate) {
            this.maximumErrorRate = maximumErrorRate;
        }

        public double getQualityThreshold() {
            return qualityThreshold;
        }

        public void setQualityThreshold(double qualityThreshold) {
            this.qualityThreshold = qualityThreshold;
        }
    }

    /**
     * Timeouts for calls into the metrics source and the event bus.
     */
    public static class Collaborators {
        @Positive
        private long metricsTimeoutMs = 5000;

        @Positive
        private long publishTimeoutMs = 2000;

        public long getMetricsTimeoutMs() {
            return metricsTimeoutMs;
        }

        public void setMetricsTimeoutMs(long metricsTimeoutMs) {
            this.metricsTimeoutMs = metricsTimeoutMs;
        }

        public long getPublishTimeoutMs() {
            return publishTimeoutMs;
        }

        public void setPublishTimeoutMs(long publishTimeoutMs) {
            this.publishTimeoutMs = publishTimeoutMs;
        }
    }

    /**
     * Periodic fleet evaluation.
     */
    public static class Schedule {
        /** Enable/disable the scheduled sweep. */
        private boolean enabled = true;

        /** Delay between sweeps in milliseconds. */
        @Positive
        private long intervalMs = 60_000L;

        /** Agents evaluated on every sweep; penalized agents are always re-checked for recovery. */
        private List<String> agentIds = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public List<String> getAgentIds() {
            return agentIds;
        }

        public void setAgentIds(List<String> agentIds) {
            this.agentIds = agentIds;
        }
    }
}
