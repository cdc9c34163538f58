package xyz.firestige.rollout.infrastructure.execution.strategy;

import xyz.firestige.rollout.domain.rollout.RolloutStrategy;

/**
 * 渐进式：按 phases 升序逐级放量
 */
public class ProgressiveRolloutRoutine extends PhasedRolloutRoutine {

    @Override
    public RolloutStrategy strategy() {
        return RolloutStrategy.PROGRESSIVE;
    }
}
