package xyz.firestige.rollout.exception;

/**
 * 指标超出阈值，或阶段校验未通过
 * 触发补偿回滚，不代表程序异常
 */
public class ThresholdBreachException extends RolloutException {

    public ThresholdBreachException(String reason) {
        super(ErrorType.THRESHOLD_BREACH, reason);
    }
}
