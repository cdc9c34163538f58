package xyz.firestige.rollout.domain.deployment;

import java.util.List;
import java.util.Optional;

/**
 * 部署历史仓储（只追加，按 deploymentId 索引）
 */
public interface DeploymentHistoryRepository {

    void append(DeploymentResult result);

    /**
     * 返回存储中的实例，调用方修改后对其他读者可见；对外暴露前必须 copy()
     */
    Optional<DeploymentResult> find(String deploymentId);

    List<DeploymentResult> query(DeploymentQuery query);
}
