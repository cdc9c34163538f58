package xyz.firestige.rollout.infrastructure.execution;

import io.micrometer.observation.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.deployment.DeploymentResult;
import xyz.firestige.rollout.domain.deployment.DeploymentStatus;
import xyz.firestige.rollout.domain.rollout.PhaseOutcome;
import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutPhase;
import xyz.firestige.rollout.domain.rollout.RolloutRuntimeContext;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.exception.ErrorType;
import xyz.firestige.rollout.exception.FailureInfo;
import xyz.firestige.rollout.exception.OrchestratorException;
import xyz.firestige.rollout.exception.AbortRequestedException;
import xyz.firestige.rollout.exception.RolloutException;
import xyz.firestige.rollout.exception.ThresholdBreachException;
import xyz.firestige.rollout.infrastructure.execution.strategy.PhaseStep;
import xyz.firestige.rollout.infrastructure.execution.strategy.RolloutRoutine;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 单个发布的执行器，在工作线程中运行一次
 *
 * <p>执行流程：
 * <pre>
 * DEPLOYING       部署新版本，记录 v{tag} → deploymentId
 *     ↓
 * routine.plan()  策略例程展开为阶段步骤
 *     ↓
 * 逐个执行步骤     CONTINUE 继续 / PROMOTE 提升到 100% / FAIL 失败处理
 *     ↓
 * COMPLETED       autoPromote 且未到 100% 时先提升
 * </pre>
 *
 * <p>失败处理：错误写入 errors，autoRollback 时执行补偿回滚，否则直接 FAILED。
 * 被中止时安静退出，补偿回滚由中止调用方同步完成；部署调用返回后打开 deploySettled，
 * 中止方据此拿到新版本的部署 ID。
 */
public class RolloutExecutor {

    private static final Logger log = LoggerFactory.getLogger(RolloutExecutor.class);

    public static final String ROLLOUT_DURATION_SECONDS = "rollout_duration_seconds";

    private final RolloutRuntimeContext context;
    private final RolloutRoutine routine;
    private final RolloutExecutionDependencies dependencies;

    public RolloutExecutor(RolloutRuntimeContext context,
                           RolloutRoutine routine,
                           RolloutExecutionDependencies dependencies) {
        this.context = context;
        this.routine = routine;
        this.dependencies = dependencies;
    }

    /**
     * 执行入口
     */
    public void execute() {
        RolloutConfig config = context.getConfig();
        context.injectMdc();
        try {
            Observation.createNotStarted("rollout_execution", dependencies.getObservationRegistry())
                    .lowCardinalityKeyValue("service", config.getServiceName())
                    .lowCardinalityKeyValue("strategy", config.getStrategy().tagValue())
                    .highCardinalityKeyValue("rollout_id", context.getRolloutId())
                    .observe(this::runRollout);
        } finally {
            context.markDeploySettled();
            context.clearMdc();
        }
    }

    private void runRollout() {
        RolloutState state = context.getState();
        RolloutConfig config = context.getConfig();
        log.info("[RolloutExecutor] 开始发布: rolloutId={}, config={}", context.getRolloutId(), config);

        try {
            deployNewVersion();

            List<PhaseStep> steps = routine.plan(config, dependencies);
            for (PhaseStep step : steps) {
                context.checkNotAborted();
                PhaseOutcome outcome = step.execute(context);
                log.debug("[RolloutExecutor] 步骤结果: {}", outcome);
                if (outcome.isFail()) {
                    handleFailure(new ThresholdBreachException(outcome.getReason())
                            .addContext("phase", state.getCurrentPhase()));
                    return;
                }
                if (outcome.isPromote()) {
                    if (!config.isAutoPromote()) {
                        log.info("[RolloutExecutor] autoPromote=false，保持当前流量 {}%", state.getCurrentTrafficPercentage());
                        break;
                    }
                    promote();
                }
            }

            context.checkNotAborted();
            if (config.isAutoPromote() && state.getCurrentTrafficPercentage() < 100) {
                promote();
            }

            if (state.complete()) {
                recordDuration("success");
                log.info("[RolloutExecutor] 发布完成: rolloutId={}, traffic={}%", context.getRolloutId(),
                        state.getCurrentTrafficPercentage());
            } else {
                log.info("[RolloutExecutor] 发布未能进入 COMPLETED，当前阶段 {}", state.getCurrentPhase());
            }
        } catch (AbortRequestedException e) {
            log.info("[RolloutExecutor] 发布已中止，执行线程退出: rolloutId={}", context.getRolloutId());
        } catch (InterruptedException e) {
            // 中断标记在补偿回滚结束后恢复，回滚调用不受中断影响
            try {
                if (state.isAbortRequested() || state.isRollbackStarted()) {
                    log.info("[RolloutExecutor] 发布已中止，执行线程被中断: rolloutId={}", context.getRolloutId());
                } else {
                    handleFailure(new RolloutException(ErrorType.SYSTEM_ERROR, "Rollout interrupted", e));
                }
            } finally {
                Thread.currentThread().interrupt();
            }
        } catch (RolloutException e) {
            handleFailure(e);
        } catch (RuntimeException e) {
            handleFailure(new RolloutException(ErrorType.SYSTEM_ERROR,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e));
        }
    }

    private void deployNewVersion() {
        try {
            deployAndRecord();
        } finally {
            context.markDeploySettled();
        }
    }

    private void deployAndRecord() {
        RolloutState state = context.getState();
        RolloutConfig config = context.getConfig();
        if (!state.transitionTo(RolloutPhase.DEPLOYING)) {
            throw new AbortRequestedException(context.getRolloutId());
        }

        DeploymentResult result;
        try {
            result = dependencies.getDeploymentAutomation().deployService(config.getDeploymentSpec());
        } catch (RolloutException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OrchestratorException("Failed to deploy new version: " + e.getMessage(), e);
        }

        String versionLabel = config.newVersionLabel();
        boolean rollbackRaced = state.recordNewDeployment(versionLabel, result.getDeploymentId());
        log.info("[RolloutExecutor] 新版本已部署: version={}, deploymentId={}, status={}",
                versionLabel, result.getDeploymentId(), result.getStatus());

        if (rollbackRaced) {
            // 中止方等待部署超时后已开始回滚，没有拿到部署 ID，这里补做部署回滚
            compensateDeployment(result.getDeploymentId());
            throw new AbortRequestedException(context.getRolloutId());
        }

        if (result.getStatus() == DeploymentStatus.FAILED) {
            throw new OrchestratorException("Failed to deploy new version: deployment "
                    + result.getDeploymentId() + " reported FAILED");
        }
    }

    private void compensateDeployment(String deploymentId) {
        RolloutState state = context.getState();
        String reason = state.getRollbackReason() != null ? state.getRollbackReason() : RollbackCoordinator.DEFAULT_REASON;
        log.warn("[RolloutExecutor] 部署期间发布被中止，补偿回滚: deploymentId={}", deploymentId);
        boolean interrupted = Thread.interrupted();
        try {
            if (!dependencies.getDeploymentAutomation().rollbackService(deploymentId, reason)) {
                state.addError(FailureInfo.of(ErrorType.ORCHESTRATOR_ERROR,
                        "Rollback of deployment " + deploymentId + " did not complete").toErrorEntry());
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void promote() {
        int lastIndex = Math.max(0, context.getConfig().getPhases().size() - 1);
        dependencies.getTrafficController().shiftTo(context, 100, lastIndex, RolloutPhase.PROMOTING);
        log.info("[RolloutExecutor] 新版本已提升到 100%: rolloutId={}", context.getRolloutId());
    }

    private void handleFailure(RolloutException e) {
        RolloutState state = context.getState();
        if (state.isAbortRequested()) {
            log.info("[RolloutExecutor] 发布已中止，忽略执行线程的失败: {}", e.getMessage());
            return;
        }

        FailureInfo failure = FailureInfo.fromException(e, e.getErrorType(), String.valueOf(state.getCurrentPhase()));
        state.addError(failure.toErrorEntry());
        state.setRollbackReasonIfAbsent(e.getMessage());
        log.error("[RolloutExecutor] 发布失败: rolloutId={}, phase={}, error={}",
                context.getRolloutId(), state.getCurrentPhase(), failure.toErrorEntry(), e);

        boolean finished;
        if (context.getConfig().isAutoRollback()) {
            finished = dependencies.getRollbackCoordinator().rollback(context, state.getRollbackReason());
        } else {
            finished = state.fail();
            log.warn("[RolloutExecutor] autoRollback=false，保持当前流量 {}%", state.getCurrentTrafficPercentage());
        }
        if (finished) {
            recordDuration("failure");
        }
    }

    private void recordDuration(String status) {
        recordDuration(context, dependencies.getMetrics(), status);
    }

    /**
     * 记录发布总时长；中止方完成补偿回滚后也通过这里补记 failure
     */
    public static void recordDuration(RolloutRuntimeContext context, MetricsRegistry metrics, String status) {
        RolloutConfig config = context.getConfig();
        double seconds = Duration.between(context.getState().getStartTime(), Instant.now()).toMillis() / 1000.0;
        metrics.recordHistogram(ROLLOUT_DURATION_SECONDS, seconds, Map.of(
                "service", config.getServiceName(),
                "strategy", config.getStrategy().tagValue(),
                "status", status));
    }
}
