package xyz.firestige.rollout.domain.deployment;

/**
 * 单次部署在编排平台上的替换方式
 */
public enum DeploymentStrategy {
    ROLLING,
    BLUE_GREEN,
    CANARY,
    RECREATE
}
