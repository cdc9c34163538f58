package xyz.firestige.rollout.infrastructure.hook;

import xyz.firestige.rollout.domain.deployment.DeploymentSpec;

/**
 * 部署成功后的集成钩子（服务网格注册、网关路由配置等）
 * 抛出的异常只记录日志，不影响部署结果
 */
public interface PostDeploymentHook {

    /**
     * 日志中使用的名称
     */
    String name();

    void afterDeployment(DeploymentSpec spec, String deploymentId) throws Exception;
}
