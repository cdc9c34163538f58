package xyz.firestige.rollout.infrastructure.execution;

import xyz.firestige.rollout.domain.rollout.RolloutRuntimeContext;

import java.time.Duration;

/**
 * 等待发布中止信号的计时器；一个"分钟"的实际时长可配置（rollout.time-unit）
 */
public class AbortAwareRolloutTimer implements RolloutTimer {

    private final Duration minute;

    public AbortAwareRolloutTimer(Duration minute) {
        this.minute = minute;
    }

    @Override
    public void sleepMinutes(RolloutRuntimeContext context, int minutes) throws InterruptedException {
        if (minutes <= 0) {
            return;
        }
        context.awaitAbortSignal(minute.multipliedBy(minutes));
        context.checkNotAborted();
    }

    public Duration getMinute() {
        return minute;
    }
}
