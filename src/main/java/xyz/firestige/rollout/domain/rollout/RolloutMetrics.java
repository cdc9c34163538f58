package xyz.firestige.rollout.domain.rollout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 发布阶段的指标阈值（SLO）
 * <p>
 * 除 success_rate 为"不得低于"外，其余均为"不得超过"。
 */
public final class RolloutMetrics {

    public static final String ERROR_RATE = "error_rate";
    public static final String RESPONSE_TIME_P95 = "response_time_p95";
    public static final String SUCCESS_RATE = "success_rate";
    public static final String CPU_USAGE = "cpu_usage";
    public static final String MEMORY_USAGE = "memory_usage";

    private final double errorRateThreshold;
    private final double responseTimeP95Threshold;
    private final double successRateThreshold;
    private final double cpuThreshold;
    private final double memoryThreshold;
    private final Map<String, Double> customMetrics;

    private RolloutMetrics(Builder b) {
        this.errorRateThreshold = b.errorRateThreshold;
        this.responseTimeP95Threshold = b.responseTimeP95Threshold;
        this.successRateThreshold = b.successRateThreshold;
        this.cpuThreshold = b.cpuThreshold;
        this.memoryThreshold = b.memoryThreshold;
        this.customMetrics = Collections.unmodifiableMap(new LinkedHashMap<>(b.customMetrics));
    }

    public static RolloutMetrics defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getErrorRateThreshold() { return errorRateThreshold; }
    public double getResponseTimeP95Threshold() { return responseTimeP95Threshold; }
    public double getSuccessRateThreshold() { return successRateThreshold; }
    public double getCpuThreshold() { return cpuThreshold; }
    public double getMemoryThreshold() { return memoryThreshold; }
    public Map<String, Double> getCustomMetrics() { return customMetrics; }

    @Override
    public String toString() {
        return "RolloutMetrics{errorRate<=" + errorRateThreshold + ", p95<=" + responseTimeP95Threshold
                + ", successRate>=" + successRateThreshold + ", cpu<=" + cpuThreshold
                + ", memory<=" + memoryThreshold + ", custom=" + customMetrics + '}';
    }

    public static final class Builder {
        private double errorRateThreshold = 0.05;
        private double responseTimeP95Threshold = 500.0;
        private double successRateThreshold = 0.95;
        private double cpuThreshold = 80.0;
        private double memoryThreshold = 90.0;
        private final Map<String, Double> customMetrics = new LinkedHashMap<>();

        public Builder errorRateThreshold(double v) { this.errorRateThreshold = v; return this; }
        public Builder responseTimeP95Threshold(double v) { this.responseTimeP95Threshold = v; return this; }
        public Builder successRateThreshold(double v) { this.successRateThreshold = v; return this; }
        public Builder cpuThreshold(double v) { this.cpuThreshold = v; return this; }
        public Builder memoryThreshold(double v) { this.memoryThreshold = v; return this; }
        public Builder customMetric(String name, double maxValue) { this.customMetrics.put(name, maxValue); return this; }

        public RolloutMetrics build() {
            return new RolloutMetrics(this);
        }
    }
}
