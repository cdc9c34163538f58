package xyz.firestige.rollout.infrastructure.execution.strategy;

import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutStrategy;
import xyz.firestige.rollout.infrastructure.execution.RolloutExecutionDependencies;

import java.util.List;

/**
 * 发布策略例程：把一个 RolloutConfig 展开为有序的阶段步骤
 */
public interface RolloutRoutine {

    RolloutStrategy strategy();

    List<PhaseStep> plan(RolloutConfig config, RolloutExecutionDependencies deps);
}
