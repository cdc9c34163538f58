package xyz.firestige.rollout.infrastructure.execution.strategy;

import xyz.firestige.rollout.domain.rollout.RolloutStrategy;
import xyz.firestige.rollout.exception.ErrorType;
import xyz.firestige.rollout.exception.RolloutException;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 策略 → 例程映射
 */
public class RolloutRoutineRegistry {

    private final Map<RolloutStrategy, RolloutRoutine> routines = new EnumMap<>(RolloutStrategy.class);

    public RolloutRoutineRegistry(List<RolloutRoutine> routines) {
        for (RolloutRoutine routine : routines) {
            this.routines.put(routine.strategy(), routine);
        }
    }

    /**
     * 内置的全部例程
     */
    public static RolloutRoutineRegistry defaults() {
        return new RolloutRoutineRegistry(Arrays.asList(
                new ProgressiveRolloutRoutine(),
                new CanaryRolloutRoutine(),
                new BlueGreenRolloutRoutine(),
                new AbTestRolloutRoutine(),
                new RingRolloutRoutine(),
                new FeatureFlagRolloutRoutine()));
    }

    public RolloutRoutine get(RolloutStrategy strategy) {
        RolloutRoutine routine = routines.get(strategy);
        if (routine == null) {
            throw new RolloutException(ErrorType.VALIDATION_ERROR, "Unsupported rollout strategy: " + strategy);
        }
        return routine;
    }

    public Set<RolloutStrategy> supportedStrategies() {
        return Collections.unmodifiableSet(routines.keySet());
    }
}
