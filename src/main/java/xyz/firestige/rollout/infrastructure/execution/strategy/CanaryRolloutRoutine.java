package xyz.firestige.rollout.infrastructure.execution.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.rollout.PhaseOutcome;
import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutPhase;
import xyz.firestige.rollout.domain.rollout.RolloutStrategy;
import xyz.firestige.rollout.infrastructure.execution.PhaseMonitor;
import xyz.firestige.rollout.infrastructure.execution.RolloutExecutionDependencies;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 金丝雀：以 phases[0]（未配置时取默认百分比）放量，
 * 保持 2 × phaseDurationMinutes，每分钟采样并校验一次，全部通过后返回 PROMOTE
 */
public class CanaryRolloutRoutine implements RolloutRoutine {

    private static final Logger log = LoggerFactory.getLogger(CanaryRolloutRoutine.class);

    @Override
    public RolloutStrategy strategy() {
        return RolloutStrategy.CANARY;
    }

    @Override
    public List<PhaseStep> plan(RolloutConfig config, RolloutExecutionDependencies deps) {
        int canaryPercentage = config.getPhases().isEmpty()
                ? deps.getDefaultCanaryPercentage()
                : config.getPhases().get(0);
        int holdMinutes = config.getPhaseDurationMinutes() * 2;

        PhaseStep canary = ctx -> {
            PhaseMonitor monitor = deps.getPhaseMonitor();
            deps.getTrafficController().shiftTo(ctx, canaryPercentage, 0, RolloutPhase.MONITORING);
            log.info("[CanaryRolloutRoutine] 发布 {} 金丝雀阶段: {}% 流量，观察 {} 分钟",
                    ctx.getRolloutId(), canaryPercentage, holdMinutes);

            for (int minute = 0; minute < holdMinutes; minute++) {
                deps.getTimer().sleepMinutes(ctx, 1);
                ctx.checkNotAborted();
                monitor.sample(ctx);
                monitor.reportProgress(ctx, minute + 1, holdMinutes);

                ctx.getState().transitionTo(RolloutPhase.VALIDATING);
                Optional<String> breach = monitor.validatePhaseMetrics(ctx.getState());
                if (breach.isPresent()) {
                    return PhaseOutcome.fail("Canary validation failed: " + breach.get());
                }
                ctx.getState().transitionTo(RolloutPhase.MONITORING);
            }
            return PhaseOutcome.promote();
        };
        return Collections.singletonList(canary);
    }
}
