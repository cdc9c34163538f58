package xyz.firestige.rollout.exception;

/**
 * 发布被主动中止
 * 执行线程在检查点发现中止请求时抛出，补偿回滚由中止调用方负责
 */
public class AbortRequestedException extends RolloutException {

    public AbortRequestedException(String rolloutId) {
        super(ErrorType.ABORT_REQUESTED, "发布已被中止: " + rolloutId);
        addContext("rolloutId", rolloutId);
    }
}
