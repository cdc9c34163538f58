package xyz.firestige.rollout.domain.deployment;

/**
 * 部署状态
 */
public enum DeploymentStatus {

    PENDING("等待中"),
    IN_PROGRESS("部署中"),
    SUCCEEDED("部署成功"),
    FAILED("部署失败"),
    ROLLING_BACK("回滚中"),
    ROLLED_BACK("已回滚");

    private final String description;

    DeploymentStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * end_time 只在终态设置
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == ROLLED_BACK;
    }
}
