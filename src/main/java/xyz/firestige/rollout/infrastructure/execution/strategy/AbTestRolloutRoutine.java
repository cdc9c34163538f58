package xyz.firestige.rollout.infrastructure.execution.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.rollout.PhaseOutcome;
import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutPhase;
import xyz.firestige.rollout.domain.rollout.RolloutStrategy;
import xyz.firestige.rollout.infrastructure.execution.PhaseMonitor;
import xyz.firestige.rollout.infrastructure.execution.RolloutExecutionDependencies;
import xyz.firestige.rollout.infrastructure.execution.validation.AbTestWinner;

import java.util.Collections;
import java.util.List;

/**
 * A/B 测试：50/50 切分，保持 4 × phaseDurationMinutes，每分钟开始时采样一次，
 * 窗口结束后比较新旧版本；新版本胜出返回 PROMOTE，否则返回 FAIL（回滚到旧版本）
 */
public class AbTestRolloutRoutine implements RolloutRoutine {

    private static final Logger log = LoggerFactory.getLogger(AbTestRolloutRoutine.class);

    static final int AB_SPLIT = 50;

    @Override
    public RolloutStrategy strategy() {
        return RolloutStrategy.A_B_TEST;
    }

    @Override
    public List<PhaseStep> plan(RolloutConfig config, RolloutExecutionDependencies deps) {
        // 至少采样一次，否则分析没有数据
        int samples = Math.max(1, config.getPhaseDurationMinutes() * 4);

        PhaseStep abTest = ctx -> {
            PhaseMonitor monitor = deps.getPhaseMonitor();
            deps.getTrafficController().shiftTo(ctx, AB_SPLIT, 0, RolloutPhase.MONITORING);
            log.info("[AbTestRolloutRoutine] 发布 {} A/B 测试开始: {}/{}，采样 {} 次",
                    ctx.getRolloutId(), 100 - AB_SPLIT, AB_SPLIT, samples);

            for (int i = 0; i < samples; i++) {
                ctx.checkNotAborted();
                monitor.sample(ctx);
                monitor.reportProgress(ctx, i + 1, samples);
                deps.getTimer().sleepMinutes(ctx, 1);
            }

            ctx.checkNotAborted();
            ctx.getState().transitionTo(RolloutPhase.VALIDATING);
            AbTestWinner winner = deps.getAbTestAnalyzer().analyze(ctx.getState().getMetricsHistory());
            if (winner == AbTestWinner.NEW) {
                return PhaseOutcome.promote();
            }
            return PhaseOutcome.fail("A/B test showed old version performing better");
        };
        return Collections.singletonList(abTest);
    }
}
