package xyz.firestige.rollout.infrastructure.persistence;

import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.rollout.RolloutRuntimeContext;
import xyz.firestige.rollout.domain.rollout.RolloutState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存实现的 RolloutRepository
 */
public class InMemoryRolloutRepository implements RolloutRepository {

    private final Map<String, RolloutRuntimeContext> contexts = new ConcurrentHashMap<>();

    @Override
    public void save(RolloutRuntimeContext context) {
        contexts.put(context.getRolloutId(), context);
    }

    @Override
    public Optional<RolloutRuntimeContext> findContext(String rolloutId) {
        return rolloutId == null ? Optional.empty() : Optional.ofNullable(contexts.get(rolloutId));
    }

    @Override
    public Optional<RolloutState> find(String rolloutId) {
        return findContext(rolloutId).map(RolloutRuntimeContext::getState);
    }

    @Override
    public List<RolloutState> findAll() {
        List<RolloutState> states = new ArrayList<>();
        contexts.values().forEach(c -> states.add(c.getState()));
        states.sort(Comparator.comparing(RolloutState::getStartTime));
        return states;
    }

    @Override
    public List<RolloutRuntimeContext> findAllContexts() {
        return new ArrayList<>(contexts.values());
    }
}
