package xyz.firestige.rollout.infrastructure.execution.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.rollout.PhaseOutcome;
import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutPhase;
import xyz.firestige.rollout.domain.rollout.RolloutRuntimeContext;
import xyz.firestige.rollout.infrastructure.execution.PhaseMonitor;
import xyz.firestige.rollout.infrastructure.execution.RolloutExecutionDependencies;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 按 phases 逐级放量的通用例程（模板方法）
 * <p>
 * 每个阶段：调整流量 → 监控 → 校验 → 非最后阶段时等待 phaseDurationMinutes。
 * 子类可定制阶段描述与校验失败时的清理动作。
 */
public abstract class PhasedRolloutRoutine implements RolloutRoutine {

    private static final Logger log = LoggerFactory.getLogger(PhasedRolloutRoutine.class);

    @Override
    public List<PhaseStep> plan(RolloutConfig config, RolloutExecutionDependencies deps) {
        List<Integer> phases = config.getPhases();
        List<PhaseStep> steps = new ArrayList<>(phases.size());
        for (int i = 0; i < phases.size(); i++) {
            steps.add(phaseStep(config, deps, i, phases.get(i), i == phases.size() - 1));
        }
        return steps;
    }

    private PhaseStep phaseStep(RolloutConfig config, RolloutExecutionDependencies deps,
                                int phaseIndex, int percentage, boolean last) {
        return ctx -> {
            PhaseMonitor monitor = deps.getPhaseMonitor();
            deps.getTrafficController().shiftTo(ctx, percentage, phaseIndex, RolloutPhase.MONITORING);
            log.info("[{}] 发布 {} 阶段 {}/{}: {}% 流量{}", getClass().getSimpleName(), ctx.getRolloutId(),
                    phaseIndex + 1, config.getPhases().size(), percentage, describePhase(config, phaseIndex));

            monitor.monitorPhase(ctx);
            ctx.checkNotAborted();
            ctx.getState().transitionTo(RolloutPhase.VALIDATING);

            Optional<String> breach = monitor.validatePhaseMetrics(ctx.getState());
            if (breach.isPresent()) {
                onPhaseFailure(ctx, deps);
                return PhaseOutcome.fail(failurePrefix() + " " + (phaseIndex + 1) + " validation failed: " + breach.get());
            }

            if (!last) {
                deps.getTimer().sleepMinutes(ctx, config.getPhaseDurationMinutes());
            }
            return PhaseOutcome.proceed();
        };
    }

    /**
     * 追加到阶段日志的说明，默认为空
     */
    protected String describePhase(RolloutConfig config, int phaseIndex) {
        return "";
    }

    protected String failurePrefix() {
        return "Phase";
    }

    /**
     * 校验失败、返回 FAIL 之前的清理动作
     */
    protected void onPhaseFailure(RolloutRuntimeContext ctx, RolloutExecutionDependencies deps) {
    }
}
