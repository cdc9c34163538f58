package xyz.firestige.rollout.infrastructure.collector;

import java.util.Map;

/**
 * 版本级指标采集（Prometheus / SigNoz 等由外部实现）
 * <p>
 * 后端失败时实现应记录日志并返回空 Map，不把传输异常抛进发布循环。
 */
public interface MetricsCollector {

    /**
     * @param serviceName     服务名
     * @param version         版本标签（新版本 v{tag}，旧版本 "old"）
     * @param durationMinutes 统计窗口
     * @return 指标名 → 值，如 error_rate、response_time_p95
     */
    Map<String, Double> collectMetrics(String serviceName, String version, int durationMinutes);
}
