package xyz.firestige.rollout.infrastructure.execution.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.rollout.MetricsSnapshot;
import xyz.firestige.rollout.domain.rollout.RolloutMetrics;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A/B 测试胜者判定
 * <p>
 * 取最近 window 个快照，分别对新旧版本的 error_rate 与 response_time_p95 求均值（缺失按 0 计），
 * 只有两项均值都严格更低时新版本胜出；数据不足或平局时旧版本胜出。
 */
public class AbTestAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(AbTestAnalyzer.class);

    private final int window;

    public AbTestAnalyzer(int window) {
        this.window = window;
    }

    public AbTestWinner analyze(List<MetricsSnapshot> history) {
        if (history.isEmpty()) {
            log.info("[AbTestAnalyzer] 无指标数据，默认旧版本胜出");
            return AbTestWinner.OLD;
        }
        List<MetricsSnapshot> recent = history.subList(Math.max(0, history.size() - window), history.size());
        List<Map<String, Double>> newMetrics = recent.stream()
                .map(MetricsSnapshot::getNewVersion).filter(m -> !m.isEmpty()).collect(Collectors.toList());
        List<Map<String, Double>> oldMetrics = recent.stream()
                .map(MetricsSnapshot::getOldVersion).filter(m -> !m.isEmpty()).collect(Collectors.toList());
        if (newMetrics.isEmpty() || oldMetrics.isEmpty()) {
            log.info("[AbTestAnalyzer] 缺少某一版本的指标（new={}, old={}），默认旧版本胜出", newMetrics.size(), oldMetrics.size());
            return AbTestWinner.OLD;
        }

        double newErrorRate = average(newMetrics, RolloutMetrics.ERROR_RATE);
        double oldErrorRate = average(oldMetrics, RolloutMetrics.ERROR_RATE);
        double newP95 = average(newMetrics, RolloutMetrics.RESPONSE_TIME_P95);
        double oldP95 = average(oldMetrics, RolloutMetrics.RESPONSE_TIME_P95);

        AbTestWinner winner = newErrorRate < oldErrorRate && newP95 < oldP95 ? AbTestWinner.NEW : AbTestWinner.OLD;
        log.info("[AbTestAnalyzer] 胜者: {} (error_rate: {} vs {}, response_time_p95: {} vs {})",
                winner, String.format("%.4f", newErrorRate), String.format("%.4f", oldErrorRate),
                String.format("%.2f", newP95), String.format("%.2f", oldP95));
        return winner;
    }

    private double average(List<Map<String, Double>> samples, String metric) {
        return samples.stream().mapToDouble(m -> m.getOrDefault(metric, 0.0)).average().orElse(0.0);
    }
}
