package com.phillippitts.agentgovernor.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the governance thread pool.
 *
 * <p>Two pools: {@code governance} runs collaborator calls (metrics fetches, event-bus
 * publishes) under a timeout; {@code sweep} fans out scheduled fleet evaluations. Sweep tasks
 * block on collaborator calls, so the two must not share threads.
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    private PoolProperties governance = new PoolProperties(4, 16, 200, "governance-pool-");
    private PoolProperties sweep = new PoolProperties(4, 4, 1000, "governance-sweep-");

    public PoolProperties getGovernance() {
        return governance;
    }

    public void setGovernance(PoolProperties governance) {
        this.governance = governance;
    }

    public PoolProperties getSweep() {
        return sweep;
    }

    public void setSweep(PoolProperties sweep) {
        this.sweep = sweep;
    }

    /**
     * Executor pool configuration.
     */
    public static class PoolProperties {
        @Positive
        private int corePoolSize;
        @Positive
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(4, 16, 200, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
