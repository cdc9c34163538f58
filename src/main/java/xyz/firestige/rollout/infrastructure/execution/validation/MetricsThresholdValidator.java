package xyz.firestige.rollout.infrastructure.execution.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.rollout.RolloutMetrics;

import java.util.Map;
import java.util.Optional;

/**
 * 新版本指标阈值校验
 * <p>
 * 检查顺序固定：error_rate → response_time_p95 → success_rate → cpu_usage → memory_usage → 自定义指标，
 * 命中第一个越界项即返回。缺失的指标不参与比较。
 */
public class MetricsThresholdValidator {

    private static final Logger log = LoggerFactory.getLogger(MetricsThresholdValidator.class);

    /**
     * @return 第一个越界项的描述；全部通过时为空
     */
    public Optional<String> findBreach(Map<String, Double> metrics, RolloutMetrics thresholds) {
        Optional<String> breach = checkMax(metrics, RolloutMetrics.ERROR_RATE, thresholds.getErrorRateThreshold());
        if (breach.isEmpty()) {
            breach = checkMax(metrics, RolloutMetrics.RESPONSE_TIME_P95, thresholds.getResponseTimeP95Threshold());
        }
        if (breach.isEmpty()) {
            Double successRate = metrics.get(RolloutMetrics.SUCCESS_RATE);
            if (successRate != null && successRate < thresholds.getSuccessRateThreshold()) {
                breach = Optional.of(RolloutMetrics.SUCCESS_RATE + " too low: " + successRate
                        + " < " + thresholds.getSuccessRateThreshold());
            }
        }
        if (breach.isEmpty()) {
            breach = checkMax(metrics, RolloutMetrics.CPU_USAGE, thresholds.getCpuThreshold());
        }
        if (breach.isEmpty()) {
            breach = checkMax(metrics, RolloutMetrics.MEMORY_USAGE, thresholds.getMemoryThreshold());
        }
        if (breach.isEmpty()) {
            for (Map.Entry<String, Double> custom : thresholds.getCustomMetrics().entrySet()) {
                breach = checkMax(metrics, custom.getKey(), custom.getValue());
                if (breach.isPresent()) {
                    break;
                }
            }
        }
        breach.ifPresent(b -> log.error("[ThresholdValidator] 指标越界: {}", b));
        return breach;
    }

    public boolean isWithinThresholds(Map<String, Double> metrics, RolloutMetrics thresholds) {
        return findBreach(metrics, thresholds).isEmpty();
    }

    private Optional<String> checkMax(Map<String, Double> metrics, String name, double threshold) {
        Double actual = metrics.get(name);
        if (actual != null && actual > threshold) {
            return Optional.of(name + " too high: " + actual + " > " + threshold);
        }
        return Optional.empty();
    }
}
