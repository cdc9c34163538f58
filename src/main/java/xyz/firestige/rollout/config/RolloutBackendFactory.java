package xyz.firestige.rollout.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.infrastructure.collector.MetricsCollector;
import xyz.firestige.rollout.infrastructure.collector.NoopMetricsCollector;
import xyz.firestige.rollout.infrastructure.flag.FeatureFlagManager;
import xyz.firestige.rollout.infrastructure.flag.InMemoryFeatureFlagManager;
import xyz.firestige.rollout.infrastructure.orchestrator.ContainerOrchestrator;
import xyz.firestige.rollout.infrastructure.orchestrator.InMemoryContainerOrchestrator;
import xyz.firestige.rollout.infrastructure.traffic.InMemoryTrafficManager;
import xyz.firestige.rollout.infrastructure.traffic.TrafficManager;

import java.util.Optional;

/**
 * 按配置键创建外部能力的适配器，启动时创建一次
 * <p>
 * 核心代码只依赖接口，具体实现只在这里出现。未知的键直接让容器启动失败。
 */
public class RolloutBackendFactory {

    private static final Logger log = LoggerFactory.getLogger(RolloutBackendFactory.class);

    public static final String IN_MEMORY = "in-memory";
    public static final String NONE = "none";

    private final RolloutProperties.Backend backend;

    public RolloutBackendFactory(RolloutProperties.Backend backend) {
        this.backend = backend;
    }

    public ContainerOrchestrator createOrchestrator() {
        String key = backend.getOrchestrator();
        if (IN_MEMORY.equals(key)) {
            log.info("[RolloutBackendFactory] ContainerOrchestrator: {}", key);
            return new InMemoryContainerOrchestrator();
        }
        throw unknown("rollout.backend.orchestrator", key);
    }

    /**
     * @return 配置为 none 时为空
     */
    public Optional<TrafficManager> createTrafficManager() {
        String key = backend.getTrafficManager();
        log.info("[RolloutBackendFactory] TrafficManager: {}", key);
        switch (key) {
            case IN_MEMORY:
                return Optional.of(new InMemoryTrafficManager());
            case NONE:
                return Optional.empty();
            default:
                throw unknown("rollout.backend.traffic-manager", key);
        }
    }

    /**
     * @return 配置为 none 时为空
     */
    public Optional<FeatureFlagManager> createFeatureFlagManager() {
        String key = backend.getFeatureFlags();
        log.info("[RolloutBackendFactory] FeatureFlagManager: {}", key);
        switch (key) {
            case IN_MEMORY:
                return Optional.of(new InMemoryFeatureFlagManager());
            case NONE:
                return Optional.empty();
            default:
                throw unknown("rollout.backend.feature-flags", key);
        }
    }

    public MetricsCollector createMetricsCollector() {
        String key = backend.getMetricsCollector();
        if (NONE.equals(key)) {
            log.info("[RolloutBackendFactory] MetricsCollector: {}（无指标，校验按 metrics-unavailable-policy 处理）", key);
            return new NoopMetricsCollector();
        }
        throw unknown("rollout.backend.metrics-collector", key);
    }

    private IllegalStateException unknown(String property, String key) {
        return new IllegalStateException("Unknown backend for " + property + ": " + key);
    }
}
