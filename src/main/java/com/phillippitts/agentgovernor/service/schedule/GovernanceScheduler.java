package com.phillippitts.agentgovernor.service.schedule;

import com.phillippitts.agentgovernor.config.properties.GovernanceProperties;
import com.phillippitts.agentgovernor.domain.Penalty;
import com.phillippitts.agentgovernor.exception.AgentGovernorException;
import com.phillippitts.agentgovernor.service.penalty.PenaltyLifecycleController;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic fleet sweep.
 *
 * <p>Each run expires overdue penalties, then visits every tracked agent in parallel. An
 * agent without a penalty is evaluated; an agent that already holds one only gets a recovery
 * check, so its penalty id, appeal and appeal deadline stay stable across sweeps. Tracked
 * agents are those listed in {@code governance.schedule.agent-ids} plus every agent that
 * currently holds a penalty.
 *
 * <p>A failure for one agent is logged and counted; it never stops the sweep.
 */
@Component
@ConditionalOnProperty(prefix = "governance.schedule", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GovernanceScheduler {

    private static final Logger LOG = LogManager.getLogger(GovernanceScheduler.class);

    private final PenaltyLifecycleController controller;
    private final GovernanceProperties properties;
    private final Executor executor;

    public GovernanceScheduler(PenaltyLifecycleController controller,
                               GovernanceProperties properties,
                               @Qualifier("sweepExecutor") Executor executor) {
        this.controller = controller;
        this.properties = properties;
        this.executor = executor;
    }

    @Scheduled(fixedDelayString = "${governance.schedule.interval-ms:60000}",
            initialDelayString = "${governance.schedule.interval-ms:60000}")
    public void scheduledSweep() {
        SweepResult result = sweep();
        if (result.penalized() > 0 || result.recovered() > 0 || result.failed() > 0 || result.expired() > 0) {
            LOG.info("Governance sweep: {}", result);
        } else {
            LOG.debug("Governance sweep: {}", result);
        }
    }

    /**
     * Runs one sweep and waits for every agent to finish.
     */
    public SweepResult sweep() {
        int expired = controller.expirePenalties();

        Set<String> agents = new LinkedHashSet<>(properties.getSchedule().getAgentIds());
        agents.addAll(controller.getPenalizedAgents());

        AtomicInteger evaluated = new AtomicInteger();
        AtomicInteger penalized = new AtomicInteger();
        AtomicInteger recovered = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        List<CompletableFuture<Void>> futures = new ArrayList<>(agents.size());
        for (String agentId : agents) {
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    if (controller.getActivePenalty(agentId) != null) {
                        if (controller.checkForRecovery(agentId)) {
                            recovered.incrementAndGet();
                        }
                        evaluated.incrementAndGet();
                        return;
                    }
                    Penalty applied = controller.evaluateAgentPerformance(agentId);
                    evaluated.incrementAndGet();
                    if (applied != null) {
                        penalized.incrementAndGet();
                    }
                } catch (AgentGovernorException e) {
                    failed.incrementAndGet();
                    LOG.warn("Sweep could not evaluate {}: {}", agentId, e.getMessage());
                } catch (RuntimeException e) {
                    failed.incrementAndGet();
                    LOG.error("Unexpected error evaluating {}", agentId, e);
                }
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        return new SweepResult(evaluated.get(), penalized.get(), recovered.get(), failed.get(), expired);
    }
}
