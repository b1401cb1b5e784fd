package com.phillippitts.agentgovernor.config;

import com.phillippitts.agentgovernor.config.properties.GovernanceProperties;
import com.phillippitts.agentgovernor.service.collaborator.BusNotifier;
import com.phillippitts.agentgovernor.service.collaborator.CollaboratorGateway;
import com.phillippitts.agentgovernor.service.collaborator.GovernanceEventBus;
import com.phillippitts.agentgovernor.service.collaborator.LoggingEventBus;
import com.phillippitts.agentgovernor.service.collaborator.MetricsSource;
import com.phillippitts.agentgovernor.service.collaborator.NominalMetricsSource;
import com.phillippitts.agentgovernor.service.collaborator.SystemConditionsProvider;
import com.phillippitts.agentgovernor.service.collaborator.SystemSnapshot;
import com.phillippitts.agentgovernor.service.evaluation.MetricsHistory;
import com.phillippitts.agentgovernor.service.evaluation.PerformanceEvaluator;
import com.phillippitts.agentgovernor.service.metrics.GovernanceMetrics;
import com.phillippitts.agentgovernor.service.penalty.PenaltyLifecycleController;
import com.phillippitts.agentgovernor.service.remediation.RemediationManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the governance engine explicitly.
 *
 * <p>Collaborators ({@link MetricsSource}, {@link GovernanceEventBus},
 * {@link SystemConditionsProvider}) fall back to local defaults when the deployment does not
 * provide its own beans.
 */
@Configuration
public class GovernanceConfig {

    private final GovernanceProperties properties;
    private final ApplicationEventPublisher publisher;

    public GovernanceConfig(GovernanceProperties properties, ApplicationEventPublisher publisher) {
        this.properties = properties;
        this.publisher = publisher;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock governanceClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsSource metricsSource() {
        return new NominalMetricsSource();
    }

    @Bean
    @ConditionalOnMissingBean
    public GovernanceEventBus governanceEventBus() {
        return new LoggingEventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public SystemConditionsProvider systemConditionsProvider() {
        return () -> SystemSnapshot.NOMINAL;
    }

    @Bean
    public CollaboratorGateway collaboratorGateway(MetricsSource metricsSource,
                                                   GovernanceEventBus eventBus,
                                                   @Qualifier("governanceExecutor") Executor executor) {
        return new CollaboratorGateway(metricsSource, eventBus, executor, properties);
    }

    @Bean
    public BusNotifier busNotifier(CollaboratorGateway gateway, GovernanceMetrics metrics) {
        return new BusNotifier(gateway, metrics);
    }

    @Bean
    public MetricsHistory metricsHistory() {
        return new MetricsHistory(properties.getEvaluator().getHistoryWindow());
    }

    @Bean
    public PerformanceEvaluator performanceEvaluator(SystemConditionsProvider conditionsProvider,
                                                     MetricsHistory metricsHistory,
                                                     Clock clock) {
        return new PerformanceEvaluator(properties, conditionsProvider, metricsHistory, clock);
    }

    @Bean
    public RemediationManager remediationManager(BusNotifier notifier, Clock clock) {
        return new RemediationManager(publisher, notifier, properties, clock);
    }

    @Bean
    public PenaltyLifecycleController penaltyLifecycleController(CollaboratorGateway gateway,
                                                                 PerformanceEvaluator evaluator,
                                                                 RemediationManager remediationManager,
                                                                 BusNotifier notifier,
                                                                 GovernanceMetrics metrics,
                                                                 Clock clock) {
        return new PenaltyLifecycleController(gateway, evaluator, remediationManager, notifier,
                publisher, metrics, properties, clock);
    }
}
