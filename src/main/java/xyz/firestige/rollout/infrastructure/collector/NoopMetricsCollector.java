package xyz.firestige.rollout.infrastructure.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;

/**
 * 未接入指标后端时使用：始终返回空结果，校验按 metrics-unavailable-policy 处理
 */
public class NoopMetricsCollector implements MetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(NoopMetricsCollector.class);

    @Override
    public Map<String, Double> collectMetrics(String serviceName, String version, int durationMinutes) {
        log.debug("[NoopMetricsCollector] 未配置指标后端: service={}, version={}", serviceName, version);
        return Collections.emptyMap();
    }
}
