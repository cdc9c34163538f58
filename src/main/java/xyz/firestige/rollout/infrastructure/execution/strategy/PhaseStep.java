package xyz.firestige.rollout.infrastructure.execution.strategy;

import xyz.firestige.rollout.domain.rollout.PhaseOutcome;
import xyz.firestige.rollout.domain.rollout.RolloutRuntimeContext;

/**
 * 发布计划中的一个步骤，只调整流量 / 阶段并返回结果，由执行器决定下一步
 */
@FunctionalInterface
public interface PhaseStep {

    PhaseOutcome execute(RolloutRuntimeContext ctx) throws InterruptedException;
}
