package xyz.firestige.rollout.infrastructure.execution.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.rollout.PhaseOutcome;
import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutPhase;
import xyz.firestige.rollout.domain.rollout.RolloutStrategy;
import xyz.firestige.rollout.infrastructure.execution.RolloutExecutionDependencies;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 蓝绿：先在零流量下校验新（绿）环境，通过后一步切到 100%，再跑一个切换后的监控窗口。
 * 切换后的校验失败同样返回 FAIL，即使流量已经切过去。
 */
public class BlueGreenRolloutRoutine implements RolloutRoutine {

    private static final Logger log = LoggerFactory.getLogger(BlueGreenRolloutRoutine.class);

    @Override
    public RolloutStrategy strategy() {
        return RolloutStrategy.BLUE_GREEN;
    }

    @Override
    public List<PhaseStep> plan(RolloutConfig config, RolloutExecutionDependencies deps) {
        int lastPhaseIndex = Math.max(0, config.getPhases().size() - 1);

        PhaseStep validateGreen = ctx -> {
            ctx.getState().transitionTo(RolloutPhase.VALIDATING);
            Optional<String> failure = deps.getDeploymentValidator().validate(ctx.getState());
            if (failure.isPresent()) {
                return PhaseOutcome.fail("Green environment validation failed: " + failure.get());
            }
            deps.getTrafficController().shiftTo(ctx, 100, lastPhaseIndex, RolloutPhase.PROMOTING);
            log.info("[BlueGreenRolloutRoutine] 发布 {} 流量已全部切换到绿环境", ctx.getRolloutId());
            return PhaseOutcome.proceed();
        };

        PhaseStep postSwitchWindow = ctx -> {
            ctx.getState().transitionTo(RolloutPhase.MONITORING);
            deps.getPhaseMonitor().monitorPhase(ctx);
            ctx.checkNotAborted();
            ctx.getState().transitionTo(RolloutPhase.VALIDATING);
            Optional<String> breach = deps.getPhaseMonitor().validatePhaseMetrics(ctx.getState());
            if (breach.isPresent()) {
                return PhaseOutcome.fail("Blue-green validation failed after traffic switch: " + breach.get());
            }
            return PhaseOutcome.proceed();
        };

        return Arrays.asList(validateGreen, postSwitchWindow);
    }
}
