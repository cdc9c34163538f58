package xyz.firestige.rollout.infrastructure.persistence;

import xyz.firestige.rollout.domain.deployment.DeploymentHistoryRepository;
import xyz.firestige.rollout.domain.deployment.DeploymentQuery;
import xyz.firestige.rollout.domain.deployment.DeploymentResult;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 内存实现的部署历史
 * <p>
 * 同一 deploymentId 只保留首次写入的条目，后续状态变化直接作用在该条目上。
 */
public class InMemoryDeploymentHistoryRepository implements DeploymentHistoryRepository {

    private final Map<String, DeploymentResult> history = new ConcurrentHashMap<>();

    @Override
    public void append(DeploymentResult result) {
        history.putIfAbsent(result.getDeploymentId(), result);
    }

    @Override
    public Optional<DeploymentResult> find(String deploymentId) {
        return deploymentId == null ? Optional.empty() : Optional.ofNullable(history.get(deploymentId));
    }

    @Override
    public List<DeploymentResult> query(DeploymentQuery query) {
        return history.values().stream()
                .filter(query::matches)
                .sorted(Comparator.comparing(DeploymentResult::getStartTime).reversed())
                .limit(Math.max(0, query.getLimit()))
                .collect(Collectors.toList());
    }
}
