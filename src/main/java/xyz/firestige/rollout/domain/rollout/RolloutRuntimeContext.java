package xyz.firestige.rollout.domain.rollout;

import org.slf4j.MDC;
import xyz.firestige.rollout.exception.AbortRequestedException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 发布运行时上下文：MDC、执行句柄与流量锁
 * <p>
 * 流量锁串行化"调整流量"与"开始回滚"，回滚开始后不会再有正向的流量写入。
 * <p>
 * 中止不中断执行线程：abortSignal 唤醒计时等待，执行线程在检查点退出；
 * deploySettled 在新版本部署调用返回（或确定不会再部署）后打开，供中止方等待部署结果。
 */
public class RolloutRuntimeContext {

    public static final String MDC_ROLLOUT_ID = "rolloutId";
    public static final String MDC_SERVICE_NAME = "serviceName";
    public static final String MDC_STRATEGY = "strategy";

    private final RolloutState state;
    private final ReentrantLock trafficLock = new ReentrantLock();
    private volatile Future<?> future;
    private final CountDownLatch abortSignal = new CountDownLatch(1);
    private final CountDownLatch deploySettled = new CountDownLatch(1);

    public RolloutRuntimeContext(RolloutState state) {
        this.state = state;
    }

    public void injectMdc() {
        MDC.put(MDC_ROLLOUT_ID, state.getRolloutId());
        MDC.put(MDC_SERVICE_NAME, state.getConfig().getServiceName());
        MDC.put(MDC_STRATEGY, state.getConfig().getStrategy().tagValue());
    }

    public void clearMdc() {
        MDC.remove(MDC_ROLLOUT_ID);
        MDC.remove(MDC_SERVICE_NAME);
        MDC.remove(MDC_STRATEGY);
    }

    /**
     * 取消执行：唤醒计时等待，尚未开始的任务不会再运行；不中断正在执行的线程
     */
    public void cancel() {
        abortSignal.countDown();
        Future<?> f = this.future;
        if (f != null && f.cancel(false)) {
            markDeploySettled();
        }
    }

    /**
     * 等待至多 timeout，期间收到中止信号则提前返回
     *
     * @return true 表示收到了中止信号
     */
    public boolean awaitAbortSignal(Duration timeout) throws InterruptedException {
        return abortSignal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void markDeploySettled() {
        deploySettled.countDown();
    }

    /**
     * 等待进行中的部署调用返回
     *
     * @return false 表示等待超时
     */
    public boolean awaitDeploySettled(Duration timeout) throws InterruptedException {
        return deploySettled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * 执行线程的检查点：已请求中止或回滚已开始时抛出
     */
    public void checkNotAborted() {
        if (state.isAbortRequested() || state.isRollbackStarted()) {
            throw new AbortRequestedException(state.getRolloutId());
        }
    }

    public RolloutState getState() { return state; }
    public RolloutConfig getConfig() { return state.getConfig(); }
    public String getRolloutId() { return state.getRolloutId(); }
    public ReentrantLock getTrafficLock() { return trafficLock; }
    public Future<?> getFuture() { return future; }
    public void setFuture(Future<?> future) { this.future = future; }
}
