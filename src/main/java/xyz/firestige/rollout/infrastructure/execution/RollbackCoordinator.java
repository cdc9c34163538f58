package xyz.firestige.rollout.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.application.deployment.DeploymentAutomation;
import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutRuntimeContext;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.exception.ErrorType;
import xyz.firestige.rollout.exception.FailureInfo;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 补偿回滚
 * <p>
 * 步骤：进入 ROLLING_BACK 并把流量归零 → TrafficManager 切回 {"old": 100, "new": 0} →
 * 关闭特性开关 → DeploymentAutomation.rollbackService → FAILED。
 * 每个外部步骤失败只记录到 errors，后续步骤照常执行，最终一定进入 FAILED。
 * 每个发布至多回滚一次，执行线程与中止线程谁先到谁执行。
 * 新版本尚未部署成功时不做任何外部调用。
 */
public class RollbackCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RollbackCoordinator.class);

    static final String DEFAULT_REASON = "Rollout validation failed";

    private final DeploymentAutomation deploymentAutomation;
    private final TrafficController trafficController;

    public RollbackCoordinator(DeploymentAutomation deploymentAutomation, TrafficController trafficController) {
        this.deploymentAutomation = deploymentAutomation;
        this.trafficController = trafficController;
    }

    /**
     * @return true 表示本次调用执行了回滚；false 表示回滚已由他方执行或发布已结束
     */
    public boolean rollback(RolloutRuntimeContext ctx, String reason) {
        RolloutState state = ctx.getState();
        RolloutConfig config = ctx.getConfig();
        String deploymentId;

        ReentrantLock lock = ctx.getTrafficLock();
        lock.lock();
        try {
            if (!state.beginRollback(reason)) {
                log.debug("[RollbackCoordinator] 回滚已开始或发布已结束，跳过: rolloutId={}", ctx.getRolloutId());
                return false;
            }
            log.info("[RollbackCoordinator] 开始回滚: rolloutId={}, reason={}", ctx.getRolloutId(), state.getRollbackReason());
            deploymentId = state.getRollbackDeploymentId();
            if (deploymentId != null) {
                runStep(state, "restore_traffic", () -> trafficController.restoreOldVersion(config));
            }
        } finally {
            lock.unlock();
        }

        if (deploymentId != null) {
            runStep(state, "disable_feature_flag", () -> trafficController.disableFeatureFlag(config));
            String rollbackReason = state.getRollbackReason() != null ? state.getRollbackReason() : DEFAULT_REASON;
            runStep(state, "rollback_deployment", () -> {
                if (!deploymentAutomation.rollbackService(deploymentId, rollbackReason)) {
                    state.addError(FailureInfo.of(ErrorType.ORCHESTRATOR_ERROR,
                            "Rollback of deployment " + deploymentId + " did not complete").toErrorEntry());
                }
            });
        } else {
            log.info("[RollbackCoordinator] 新版本未部署，无需外部回滚: rolloutId={}", ctx.getRolloutId());
        }

        state.fail();
        log.info("[RollbackCoordinator] 回滚结束: rolloutId={}, deploymentId={}", ctx.getRolloutId(), deploymentId);
        return true;
    }

    private void runStep(RolloutState state, String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("[RollbackCoordinator] 回滚步骤失败: rolloutId={}, step={}", state.getRolloutId(), step, e);
            state.addError(FailureInfo.fromException(e, ErrorType.ORCHESTRATOR_ERROR, step).toErrorEntry());
        }
    }
}
