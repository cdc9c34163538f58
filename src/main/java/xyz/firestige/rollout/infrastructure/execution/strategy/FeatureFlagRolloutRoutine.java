package xyz.firestige.rollout.infrastructure.execution.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutRuntimeContext;
import xyz.firestige.rollout.domain.rollout.RolloutStrategy;
import xyz.firestige.rollout.infrastructure.execution.RolloutExecutionDependencies;

/**
 * 特性开关发布：阶段序列同渐进式，流量塑形改为 enableFlag(flag, percentage)
 * 校验失败时先关闭开关再返回 FAIL。
 */
public class FeatureFlagRolloutRoutine extends PhasedRolloutRoutine {

    private static final Logger log = LoggerFactory.getLogger(FeatureFlagRolloutRoutine.class);

    @Override
    public RolloutStrategy strategy() {
        return RolloutStrategy.FEATURE_FLAG;
    }

    @Override
    protected String describePhase(RolloutConfig config, int phaseIndex) {
        return ", flag=" + config.featureFlagName();
    }

    @Override
    protected String failurePrefix() {
        return "Feature flag phase";
    }

    @Override
    protected void onPhaseFailure(RolloutRuntimeContext ctx, RolloutExecutionDependencies deps) {
        log.warn("[FeatureFlagRolloutRoutine] 阶段校验失败，关闭特性开关: flag={}", ctx.getConfig().featureFlagName());
        deps.getTrafficController().disableFeatureFlag(ctx.getConfig());
    }
}
