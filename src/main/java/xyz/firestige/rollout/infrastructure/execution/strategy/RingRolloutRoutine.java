package xyz.firestige.rollout.infrastructure.execution.strategy;

import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutStrategy;

/**
 * 分环发布：与渐进式相同的阶段序列，第 i 个阶段归属 targetGroups[i]（若配置）
 */
public class RingRolloutRoutine extends PhasedRolloutRoutine {

    @Override
    public RolloutStrategy strategy() {
        return RolloutStrategy.RING;
    }

    @Override
    protected String describePhase(RolloutConfig config, int phaseIndex) {
        if (phaseIndex < config.getTargetGroups().size()) {
            return ", ring=" + config.getTargetGroups().get(phaseIndex);
        }
        return "";
    }

    @Override
    protected String failurePrefix() {
        return "Ring phase";
    }
}
