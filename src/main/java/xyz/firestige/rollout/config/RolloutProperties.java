package xyz.firestige.rollout.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import xyz.firestige.rollout.domain.rollout.MetricsUnavailablePolicy;

import java.time.Duration;

/**
 * 发布引擎配置属性
 * prefix: rollout
 */
@ConfigurationProperties(prefix = "rollout")
@Validated
public class RolloutProperties {

    /** 同时运行的发布上限（线程池大小） */
    @Min(1)
    private int maxConcurrentRollouts = 10;

    /** 阶段时长、校验时长和采样间隔中"一分钟"的实际长度，测试中可缩短 */
    @NotNull
    private Duration timeUnit = Duration.ofMinutes(1);

    /** 中止发生在部署期间时，中止方等待部署调用返回的上限；超时后由执行线程补做部署回滚 */
    @NotNull
    private Duration abortDeployWait = Duration.ofSeconds(30);

    /** 无可用指标时的校验结论 */
    @NotNull
    private MetricsUnavailablePolicy metricsUnavailablePolicy = MetricsUnavailablePolicy.FAIL_OPEN;

    /** A/B 胜者分析使用的最近快照数 */
    @Min(1)
    private int abTestWindow = 10;

    /** phases 为空时金丝雀使用的流量百分比 */
    @Min(0)
    @Max(100)
    private int defaultCanaryPercentage = 5;

    @Valid
    @NotNull
    private Backend backend = new Backend();

    @Valid
    @NotNull
    private HealthCheck healthCheck = new HealthCheck();

    // ========== Backend ==========
    public static class Backend {
        /** ContainerOrchestrator 实现：in-memory */
        @NotBlank
        private String orchestrator = RolloutBackendFactory.IN_MEMORY;
        /** TrafficManager 实现：none / in-memory */
        @NotBlank
        private String trafficManager = RolloutBackendFactory.IN_MEMORY;
        /** FeatureFlagManager 实现：none / in-memory */
        @NotBlank
        private String featureFlags = RolloutBackendFactory.IN_MEMORY;
        /** MetricsCollector 实现：none */
        @NotBlank
        private String metricsCollector = RolloutBackendFactory.NONE;
        public String getOrchestrator() { return orchestrator; }
        public void setOrchestrator(String orchestrator) { this.orchestrator = orchestrator; }
        public String getTrafficManager() { return trafficManager; }
        public void setTrafficManager(String trafficManager) { this.trafficManager = trafficManager; }
        public String getFeatureFlags() { return featureFlags; }
        public void setFeatureFlags(String featureFlags) { this.featureFlags = featureFlags; }
        public String getMetricsCollector() { return metricsCollector; }
        public void setMetricsCollector(String metricsCollector) { this.metricsCollector = metricsCollector; }
    }

    // ========== HealthCheck ==========
    public static class HealthCheck {
        /** HTTP / TCP 探测的连接与读取超时 */
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    }

    public int getMaxConcurrentRollouts() { return maxConcurrentRollouts; }
    public void setMaxConcurrentRollouts(int maxConcurrentRollouts) { this.maxConcurrentRollouts = maxConcurrentRollouts; }
    public Duration getTimeUnit() { return timeUnit; }
    public void setTimeUnit(Duration timeUnit) { this.timeUnit = timeUnit; }
    public Duration getAbortDeployWait() { return abortDeployWait; }
    public void setAbortDeployWait(Duration abortDeployWait) { this.abortDeployWait = abortDeployWait; }
    public MetricsUnavailablePolicy getMetricsUnavailablePolicy() { return metricsUnavailablePolicy; }
    public void setMetricsUnavailablePolicy(MetricsUnavailablePolicy metricsUnavailablePolicy) {
        this.metricsUnavailablePolicy = metricsUnavailablePolicy;
    }
    public int getAbTestWindow() { return abTestWindow; }
    public void setAbTestWindow(int abTestWindow) { this.abTestWindow = abTestWindow; }
    public int getDefaultCanaryPercentage() { return defaultCanaryPercentage; }
    public void setDefaultCanaryPercentage(int defaultCanaryPercentage) { this.defaultCanaryPercentage = defaultCanaryPercentage; }
    public Backend getBackend() { return backend; }
    public void setBackend(Backend backend) { this.backend = backend; }
    public HealthCheck getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheck healthCheck) { this.healthCheck = healthCheck; }
}
