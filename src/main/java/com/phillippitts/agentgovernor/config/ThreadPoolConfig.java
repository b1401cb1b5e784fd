package com.phillippitts.agentgovernor.config;

import com.phillippitts.agentgovernor.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by governance I/O and fleet sweeps.
 *
 * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
 * are full the caller executes the task itself, giving backpressure instead of failing fast.
 *
 * <p>MDC propagation: copies the Log4j2 ThreadContext (agentId, operation) from the
 * submitting thread to the worker so collaborator logs keep their correlation keys.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for collaborator calls (metrics fetches and event-bus publishes).
     *
     * @return configured executor, sized via {@code threadpool.governance.*}
     */
    @Bean(name = "governanceExecutor")
    public ThreadPoolTaskExecutor governanceExecutor() {
        return build(threadPoolProperties.getGovernance());
    }

    /**
     * Executor for the scheduled fleet sweep. Kept apart from {@link #governanceExecutor()}
     * because sweep tasks wait on collaborator calls running there.
     *
     * @return configured executor, sized via {@code threadpool.sweep.*}
     */
    @Bean(name = "sweepExecutor")
    public ThreadPoolTaskExecutor sweepExecutor() {
        return build(threadPoolProperties.getSweep());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext into the worker and restores the
     * worker's previous context afterwards.
     */
    static TaskDecorator threadContextPropagator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
