package xyz.firestige.rollout.domain.rollout;

import java.util.List;
import java.util.Optional;

/**
 * 发布仓储：按 rolloutId 保存运行时上下文（含状态聚合），条目只增不删
 */
public interface RolloutRepository {

    void save(RolloutRuntimeContext context);

    Optional<RolloutRuntimeContext> findContext(String rolloutId);

    Optional<RolloutState> find(String rolloutId);

    List<RolloutState> findAll();

    List<RolloutRuntimeContext> findAllContexts();
}
