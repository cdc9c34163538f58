package xyz.firestige.rollout.infrastructure.execution;

import xyz.firestige.rollout.domain.rollout.RolloutRuntimeContext;

/**
 * 发布引擎的计时抽象，以"分钟"为单位暂停执行线程
 */
public interface RolloutTimer {

    /**
     * 暂停 minutes 个时间单位；0 或负数立即返回。发布被中止时提前醒来并抛出 AbortRequestedException
     *
     * @throws InterruptedException 执行线程被中断（线程池关闭）
     */
    void sleepMinutes(RolloutRuntimeContext context, int minutes) throws InterruptedException;
}
