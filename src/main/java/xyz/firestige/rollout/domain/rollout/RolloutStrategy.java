package xyz.firestige.rollout.domain.rollout;

/**
 * 发布策略
 */
public enum RolloutStrategy {

    PROGRESSIVE("渐进式"),
    CANARY("金丝雀"),
    BLUE_GREEN("蓝绿"),
    A_B_TEST("A/B 测试"),
    RING("分环"),
    FEATURE_FLAG("特性开关");

    private final String description;

    RolloutStrategy(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 指标 / 日志中使用的小写标签
     */
    public String tagValue() {
        return name().toLowerCase();
    }
}
