package xyz.firestige.rollout.domain.rollout;

/**
 * 没有任何指标快照时的校验策略
 */
public enum MetricsUnavailablePolicy {

    /**
     * 放行（默认）
     */
    FAIL_OPEN,

    /**
     * 视为校验失败
     */
    FAIL_CLOSED
}
