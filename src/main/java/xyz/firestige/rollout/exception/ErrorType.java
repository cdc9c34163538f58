package xyz.firestige.rollout.exception;

/**
 * 错误类型枚举
 * 用于区分发布过程中的失败来源，决定是否触发回滚
 */
public enum ErrorType {

    /**
     * 部署规格 / 发布配置校验失败，发生在任何外部调用之前
     */
    VALIDATION_ERROR("校验错误"),

    /**
     * 底层容器编排平台失败（deploy/scale/rollback）
     */
    ORCHESTRATOR_ERROR("编排平台错误"),

    /**
     * 指标采集不可用，非致命
     */
    METRICS_UNAVAILABLE("指标不可用"),

    /**
     * 指标超出阈值，驱动回滚
     */
    THRESHOLD_BREACH("指标越界"),

    /**
     * 用户主动中止
     */
    ABORT_REQUESTED("主动中止"),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
