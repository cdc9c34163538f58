package xyz.firestige.rollout.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;
import xyz.firestige.rollout.application.deployment.DeploymentAutomation;
import xyz.firestige.rollout.application.deployment.DeploymentSpecValidator;
import xyz.firestige.rollout.application.rollout.RolloutConfigValidator;
import xyz.firestige.rollout.application.rollout.RolloutOrchestrator;
import xyz.firestige.rollout.config.RolloutBackendFactory;
import xyz.firestige.rollout.config.RolloutProperties;
import xyz.firestige.rollout.domain.deployment.DeploymentHistoryRepository;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.health.RolloutEngineHealthIndicator;
import xyz.firestige.rollout.infrastructure.collector.MetricsCollector;
import xyz.firestige.rollout.infrastructure.execution.DeploymentValidator;
import xyz.firestige.rollout.infrastructure.execution.PhaseMonitor;
import xyz.firestige.rollout.infrastructure.execution.RollbackCoordinator;
import xyz.firestige.rollout.infrastructure.execution.RolloutExecutionDependencies;
import xyz.firestige.rollout.infrastructure.execution.RolloutTimer;
import xyz.firestige.rollout.infrastructure.execution.AbortAwareRolloutTimer;
import xyz.firestige.rollout.infrastructure.execution.TrafficController;
import xyz.firestige.rollout.infrastructure.execution.strategy.RolloutRoutineRegistry;
import xyz.firestige.rollout.infrastructure.execution.validation.AbTestAnalyzer;
import xyz.firestige.rollout.infrastructure.execution.validation.MetricsThresholdValidator;
import xyz.firestige.rollout.infrastructure.flag.FeatureFlagManager;
import xyz.firestige.rollout.infrastructure.health.HealthCheckClient;
import xyz.firestige.rollout.infrastructure.health.RestTemplateHealthCheckClient;
import xyz.firestige.rollout.infrastructure.hook.PostDeploymentHook;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollout.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.rollout.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.rollout.infrastructure.orchestrator.ContainerOrchestrator;
import xyz.firestige.rollout.infrastructure.persistence.InMemoryDeploymentHistoryRepository;
import xyz.firestige.rollout.infrastructure.persistence.InMemoryRolloutRepository;
import xyz.firestige.rollout.infrastructure.traffic.TrafficManager;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 发布引擎自动装配
 * <p>
 * 外部能力（编排器 / 流量 / 特性开关 / 指标采集）默认由 {@link RolloutBackendFactory} 按配置创建，
 * 容器中已有同类型 Bean 时使用已有的 Bean。
 */
@AutoConfiguration
@EnableConfigurationProperties(RolloutProperties.class)
public class RolloutEngineAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RolloutEngineAutoConfiguration.class);

    // ========== 外部能力 ==========

    @Bean
    @ConditionalOnMissingBean
    public RolloutBackendFactory rolloutBackendFactory(RolloutProperties props) {
        return new RolloutBackendFactory(props.getBackend());
    }

    @Bean
    @ConditionalOnMissingBean
    public ContainerOrchestrator containerOrchestrator(RolloutBackendFactory factory) {
        return factory.createOrchestrator();
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsCollector metricsCollector(RolloutBackendFactory factory) {
        return factory.createMetricsCollector();
    }

    @Bean
    @ConditionalOnMissingBean
    public RestTemplate restTemplate(RolloutProperties props) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMillis = (int) props.getHealthCheck().getConnectTimeout().toMillis();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        return new RestTemplate(requestFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public HealthCheckClient healthCheckClient(RestTemplate restTemplate, RolloutProperties props) {
        return new RestTemplateHealthCheckClient(restTemplate, props.getHealthCheck().getConnectTimeout());
    }

    // ========== 可观测性 ==========

    @Bean
    @ConditionalOnMissingBean
    public MetricsRegistry rolloutMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            log.info("[RolloutEngine] 未发现 MeterRegistry，使用 NoopMetricsRegistry");
            return new NoopMetricsRegistry();
        }
        return new MicrometerMetricsRegistry(registry);
    }

    // ========== 部署自动化 ==========

    @Bean
    @ConditionalOnMissingBean
    public DeploymentHistoryRepository deploymentHistoryRepository() {
        return new InMemoryDeploymentHistoryRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeploymentSpecValidator deploymentSpecValidator(ObjectProvider<Validator> validator) {
        return new DeploymentSpecValidator(validator.getIfAvailable(
                () -> Validation.buildDefaultValidatorFactory().getValidator()));
    }

    @Bean
    @ConditionalOnMissingBean
    public DeploymentAutomation deploymentAutomation(ContainerOrchestrator orchestrator,
                                                     DeploymentHistoryRepository historyRepository,
                                                     DeploymentSpecValidator specValidator,
                                                     ObjectProvider<PostDeploymentHook> hooks,
                                                     MetricsRegistry metricsRegistry,
                                                     ObjectProvider<ObservationRegistry> observationRegistry) {
        List<PostDeploymentHook> hookList = hooks.orderedStream().collect(Collectors.toList());
        log.info("[RolloutEngine] DeploymentAutomation: orchestrator={}, hooks={}",
                orchestrator.getClass().getSimpleName(), hookList.size());
        return new DeploymentAutomation(orchestrator, historyRepository, specValidator, hookList,
                metricsRegistry, observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
    }

    // ========== 发布编排 ==========

    @Bean
    @ConditionalOnMissingBean
    public RolloutRepository rolloutRepository() {
        return new InMemoryRolloutRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public RolloutRoutineRegistry rolloutRoutineRegistry() {
        return RolloutRoutineRegistry.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public RolloutTimer rolloutTimer(RolloutProperties props) {
        return new AbortAwareRolloutTimer(props.getTimeUnit());
    }

    @Bean
    @ConditionalOnMissingBean
    public TrafficController trafficController(RolloutBackendFactory factory,
                                               ObjectProvider<TrafficManager> trafficManager,
                                               ObjectProvider<FeatureFlagManager> featureFlagManager) {
        TrafficManager traffic = trafficManager.getIfAvailable(() -> factory.createTrafficManager().orElse(null));
        FeatureFlagManager flags = featureFlagManager.getIfAvailable(() -> factory.createFeatureFlagManager().orElse(null));
        log.info("[RolloutEngine] TrafficController: trafficManager={}, featureFlagManager={}",
                traffic != null ? traffic.getClass().getSimpleName() : "none",
                flags != null ? flags.getClass().getSimpleName() : "none");
        return new TrafficController(traffic, flags);
    }

    @Bean
    @ConditionalOnMissingBean
    public RolloutExecutionDependencies rolloutExecutionDependencies(DeploymentAutomation deploymentAutomation,
                                                                     MetricsCollector metricsCollector,
                                                                     TrafficController trafficController,
                                                                     HealthCheckClient healthCheckClient,
                                                                     RolloutTimer timer,
                                                                     MetricsRegistry metricsRegistry,
                                                                     ObjectProvider<ObservationRegistry> observationRegistry,
                                                                     RolloutProperties props) {
        PhaseMonitor phaseMonitor = new PhaseMonitor(metricsCollector, new MetricsThresholdValidator(),
                metricsRegistry, timer, props.getMetricsUnavailablePolicy());
        return new RolloutExecutionDependencies(
                deploymentAutomation,
                phaseMonitor,
                trafficController,
                new RollbackCoordinator(deploymentAutomation, trafficController),
                new DeploymentValidator(deploymentAutomation, healthCheckClient),
                new AbTestAnalyzer(props.getAbTestWindow()),
                timer,
                metricsRegistry,
                observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP),
                props.getDefaultCanaryPercentage());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RolloutOrchestrator rolloutOrchestrator(RolloutRepository rolloutRepository,
                                                   RolloutRoutineRegistry routineRegistry,
                                                   RolloutExecutionDependencies dependencies,
                                                   DeploymentSpecValidator specValidator,
                                                   RolloutProperties props) {
        log.info("[RolloutEngine] RolloutOrchestrator: maxConcurrentRollouts={}, timeUnit={}, metricsUnavailablePolicy={}",
                props.getMaxConcurrentRollouts(), props.getTimeUnit(), props.getMetricsUnavailablePolicy());
        return new RolloutOrchestrator(rolloutRepository, routineRegistry, dependencies,
                new RolloutConfigValidator(specValidator, routineRegistry.supportedStrategies()),
                props.getMaxConcurrentRollouts(), props.getAbortDeployWait());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    static class RolloutHealthConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RolloutEngineHealthIndicator rolloutEngineHealthIndicator(RolloutOrchestrator rolloutOrchestrator) {
            return new RolloutEngineHealthIndicator(rolloutOrchestrator);
        }
    }
}
