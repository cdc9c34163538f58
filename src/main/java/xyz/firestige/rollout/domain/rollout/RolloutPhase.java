package xyz.firestige.rollout.domain.rollout;

/**
 * 发布阶段
 */
public enum RolloutPhase {

    INITIALIZING("初始化"),
    DEPLOYING("部署新版本"),
    MONITORING("监控中"),
    VALIDATING("校验中"),
    PROMOTING("提升中"),
    COMPLETED("已完成"),
    FAILED("已失败"),
    ROLLING_BACK("回滚中");

    private final String description;

    RolloutPhase(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 正向推进阶段：只有这些阶段允许流量上调
     */
    public boolean isForward() {
        return this == MONITORING || this == VALIDATING || this == PROMOTING;
    }
}
