package xyz.firestige.rollout.infrastructure.orchestrator;

import xyz.firestige.rollout.domain.deployment.DeploymentSpec;
import xyz.firestige.rollout.domain.deployment.DeploymentStatus;

/**
 * 容器编排平台适配接口（Kubernetes / Docker 等由外部实现）
 */
public interface ContainerOrchestrator {

    /**
     * 为规格分配资源并立即返回唯一 ID。
     * 内部失败时实现必须先记录 FAILED 结果再抛出，保证调用方仍可查询状态。
     */
    String deploy(DeploymentSpec spec);

    /**
     * 纯读取；未知 ID 返回 FAILED，不抛异常
     */
    DeploymentStatus getDeploymentStatus(String deploymentId);

    /**
     * 恢复同一服务最近一次 SUCCEEDED 的部署（排除给定 ID，按开始时间倒序）
     *
     * @return 没有可恢复的部署时返回 false
     */
    boolean rollback(String deploymentId);

    /**
     * 尽力而为，失败返回 false，不抛异常
     */
    boolean scale(String serviceName, int replicas);
}
