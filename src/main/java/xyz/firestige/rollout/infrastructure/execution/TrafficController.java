package xyz.firestige.rollout.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutPhase;
import xyz.firestige.rollout.domain.rollout.RolloutRuntimeContext;
import xyz.firestige.rollout.domain.rollout.RolloutStrategy;
import xyz.firestige.rollout.exception.ErrorType;
import xyz.firestige.rollout.exception.AbortRequestedException;
import xyz.firestige.rollout.exception.RolloutException;
import xyz.firestige.rollout.infrastructure.flag.FeatureFlagManager;
import xyz.firestige.rollout.infrastructure.traffic.TrafficManager;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 流量调整
 * <p>
 * FEATURE_FLAG 策略通过特性开关百分比塑形，其余策略通过 TrafficManager 设置 {"old": 100-p, "new": p}。
 * 未配置 TrafficManager 时只更新状态中的流量值。外部调用完成后才更新状态，
 * 因此随后的监控窗口总是对应已生效的切分。
 */
public class TrafficController {

    private static final Logger log = LoggerFactory.getLogger(TrafficController.class);

    static final String NEW_VERSION_KEY = "new";

    private final TrafficManager trafficManager;
    private final FeatureFlagManager featureFlagManager;

    public TrafficController(TrafficManager trafficManager, FeatureFlagManager featureFlagManager) {
        this.trafficManager = trafficManager;
        this.featureFlagManager = featureFlagManager;
    }

    /**
     * 把新版本流量调整到 percentage，并把阶段推进到 phase
     *
     * @throws AbortRequestedException 回滚已开始
     */
    public void shiftTo(RolloutRuntimeContext ctx, int percentage, int phaseIndex, RolloutPhase phase) {
        RolloutConfig config = ctx.getConfig();
        ReentrantLock lock = ctx.getTrafficLock();
        lock.lock();
        try {
            ctx.checkNotAborted();
            if (config.getStrategy() == RolloutStrategy.FEATURE_FLAG) {
                requireFeatureFlagManager().enableFlag(config.featureFlagName(), percentage, config.featureFlagFilters());
            } else if (trafficManager != null) {
                trafficManager.setTrafficSplit(config.getServiceName(), weights(percentage));
            }
            if (!ctx.getState().shiftTraffic(percentage, phaseIndex, phase)) {
                throw new AbortRequestedException(ctx.getRolloutId());
            }
            log.info("[TrafficController] 流量已调整: service={}, new={}%, phase={}",
                    config.getServiceName(), percentage, phase);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 流量全部切回旧版本；调用方需持有流量锁
     */
    public void restoreOldVersion(RolloutConfig config) {
        if (trafficManager == null) {
            return;
        }
        trafficManager.setTrafficSplit(config.getServiceName(), weights(0));
        log.info("[TrafficController] 流量已切回旧版本: service={}", config.getServiceName());
    }

    /**
     * 关闭发布使用的特性开关；非 FEATURE_FLAG 策略或未配置开关管理器时跳过
     */
    public void disableFeatureFlag(RolloutConfig config) {
        if (config.getStrategy() != RolloutStrategy.FEATURE_FLAG || featureFlagManager == null) {
            return;
        }
        featureFlagManager.disableFlag(config.featureFlagName());
        log.info("[TrafficController] 特性开关已关闭: flag={}", config.featureFlagName());
    }

    private FeatureFlagManager requireFeatureFlagManager() {
        if (featureFlagManager == null) {
            throw new RolloutException(ErrorType.SYSTEM_ERROR, "Feature flag manager not configured");
        }
        return featureFlagManager;
    }

    static Map<String, Integer> weights(int newPercentage) {
        Map<String, Integer> weights = new LinkedHashMap<>();
        weights.put(RolloutConfig.OLD_VERSION_LABEL, 100 - newPercentage);
        weights.put(NEW_VERSION_KEY, newPercentage);
        return weights;
    }
}
