package xyz.firestige.rollout.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.rollout.MetricsSnapshot;
import xyz.firestige.rollout.domain.rollout.MetricsUnavailablePolicy;
import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutRuntimeContext;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.exception.ErrorType;
import xyz.firestige.rollout.exception.FailureInfo;
import xyz.firestige.rollout.infrastructure.collector.MetricsCollector;
import xyz.firestige.rollout.infrastructure.execution.validation.MetricsThresholdValidator;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * 阶段监控原语
 * <p>
 * monitorPhase：按 validationDurationMinutes 每分钟采样一次新旧版本指标，写入 metricsHistory，
 * 上报 rollout_phase_progress；采样之间等待一分钟，最后一次采样后不等待。
 * <p>
 * validatePhaseMetrics：只看最新快照的新版本指标；没有可用指标时按 {@link MetricsUnavailablePolicy} 处理。
 */
public class PhaseMonitor {

    private static final Logger log = LoggerFactory.getLogger(PhaseMonitor.class);

    static final String PHASE_PROGRESS_GAUGE = "rollout_phase_progress";

    private final MetricsCollector metricsCollector;
    private final MetricsThresholdValidator thresholdValidator;
    private final MetricsRegistry metrics;
    private final RolloutTimer timer;
    private final MetricsUnavailablePolicy unavailablePolicy;

    public PhaseMonitor(MetricsCollector metricsCollector,
                        MetricsThresholdValidator thresholdValidator,
                        MetricsRegistry metrics,
                        RolloutTimer timer,
                        MetricsUnavailablePolicy unavailablePolicy) {
        this.metricsCollector = metricsCollector;
        this.thresholdValidator = thresholdValidator;
        this.metrics = metrics;
        this.timer = timer;
        this.unavailablePolicy = unavailablePolicy;
    }

    public void monitorPhase(RolloutRuntimeContext ctx) throws InterruptedException {
        int samples = ctx.getConfig().getValidationDurationMinutes();
        for (int minute = 0; minute < samples; minute++) {
            ctx.checkNotAborted();
            sample(ctx);
            reportProgress(ctx, minute + 1, samples);
            if (minute < samples - 1) {
                timer.sleepMinutes(ctx, 1);
            }
        }
    }

    /**
     * 采样一次：新版本总是采集，旧版本仅在流量未全部切到新版本时采集
     */
    public MetricsSnapshot sample(RolloutRuntimeContext ctx) {
        RolloutState state = ctx.getState();
        RolloutConfig config = ctx.getConfig();
        int traffic = state.getCurrentTrafficPercentage();

        Map<String, Double> newMetrics = collectSafely(state, config.newVersionLabel());
        Map<String, Double> oldMetrics = traffic < 100
                ? collectSafely(state, RolloutConfig.OLD_VERSION_LABEL)
                : Collections.emptyMap();

        MetricsSnapshot snapshot = new MetricsSnapshot(newMetrics, oldMetrics, traffic, Instant.now(), state.getPhaseIndex());
        state.appendSnapshot(snapshot);
        log.debug("[PhaseMonitor] 采样: {}", snapshot);
        return snapshot;
    }

    public void reportProgress(RolloutRuntimeContext ctx, int done, int total) {
        double progress = total <= 0 ? 100.0 : done * 100.0 / total;
        metrics.setGauge(PHASE_PROGRESS_GAUGE, progress, Map.of(
                "rollout_id", ctx.getRolloutId(),
                "phase", String.valueOf(ctx.getState().getPhaseIndex())));
    }

    /**
     * @return 校验失败原因；通过时为空
     */
    public Optional<String> validatePhaseMetrics(RolloutState state) {
        MetricsSnapshot latest = state.latestSnapshot();
        if (latest == null || latest.getNewVersion().isEmpty()) {
            if (unavailablePolicy == MetricsUnavailablePolicy.FAIL_CLOSED) {
                log.warn("[PhaseMonitor] 无可用指标，按 FAIL_CLOSED 判定失败: rolloutId={}", state.getRolloutId());
                return Optional.of("no metrics available (FAIL_CLOSED)");
            }
            log.warn("[PhaseMonitor] 无可用指标，按 FAIL_OPEN 放行: rolloutId={}", state.getRolloutId());
            return Optional.empty();
        }
        Optional<String> breach = thresholdValidator.findBreach(latest.getNewVersion(), state.getConfig().getMetricsThresholds());
        if (breach.isEmpty()) {
            log.info("[PhaseMonitor] 阶段校验通过: rolloutId={}, phaseIndex={}", state.getRolloutId(), latest.getPhaseIndex());
        }
        return breach;
    }

    private Map<String, Double> collectSafely(RolloutState state, String version) {
        RolloutConfig config = state.getConfig();
        try {
            Map<String, Double> collected = metricsCollector.collectMetrics(
                    config.getServiceName(), version, config.getValidationDurationMinutes());
            return collected != null ? collected : Collections.emptyMap();
        } catch (RuntimeException e) {
            // 采集失败降级为"无指标"，由 unavailablePolicy 决定是否放行
            log.warn("[PhaseMonitor] 指标采集失败: service={}, version={}, error={}",
                    config.getServiceName(), version, e.getMessage());
            state.addError(FailureInfo.of(ErrorType.METRICS_UNAVAILABLE,
                    "Metrics collection failed for " + version + ": " + e.getMessage()).toErrorEntry());
            return Collections.emptyMap();
        }
    }
}
