package xyz.firestige.rollout.domain.rollout;

import xyz.firestige.rollout.domain.state.RolloutStateMachine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 发布状态聚合
 * <p>
 * 由发布执行线程独占推进；中止线程只通过 {@link #requestAbort(String)} /
 * {@link #beginRollback(String)} 介入。所有方法在自身监视器上同步，对外读取走 {@link #snapshot()}。
 * <p>
 * 不变式：
 * <ul>
 *   <li>正向推进期间流量只增不减，进入 ROLLING_BACK 时强制归零</li>
 *   <li>phaseIndex 单调不减，且不超过 phases.size()-1</li>
 *   <li>metricsHistory / errors 只追加</li>
 *   <li>回滚至多开始一次</li>
 * </ul>
 */
public class RolloutState {

    private static final String DEFAULT_ABORT_REASON = "Rollout aborted";

    private final String rolloutId;
    private final RolloutConfig config;
    private final Instant startTime;
    private final RolloutStateMachine<RolloutState> stateMachine;

    private int currentTrafficPercentage;
    private int phaseIndex;
    private Instant phaseStartTime;
    private Instant endTime;
    private final Map<String, String> deploymentIds = new LinkedHashMap<>();
    private final List<MetricsSnapshot> metricsHistory = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private String rollbackReason;

    private boolean abortRequested;
    private boolean rollbackStarted;
    private String rollbackDeploymentId;

    public RolloutState(String rolloutId, RolloutConfig config) {
        this.rolloutId = rolloutId;
        this.config = config;
        this.startTime = Instant.now();
        this.phaseStartTime = startTime;
        this.stateMachine = new RolloutStateMachine<>(RolloutPhase.INITIALIZING);
        // 中止或回滚开始后，正向阶段一律拒绝
        for (RolloutPhase phase : new RolloutPhase[]{RolloutPhase.DEPLOYING, RolloutPhase.MONITORING,
                RolloutPhase.VALIDATING, RolloutPhase.PROMOTING, RolloutPhase.COMPLETED}) {
            stateMachine.registerGuard(phase, s -> !s.abortRequested && !s.rollbackStarted);
        }
    }

    public synchronized boolean transitionTo(RolloutPhase phase) {
        return stateMachine.transitionTo(phase, this);
    }

    /**
     * 记录新版本部署 ID
     *
     * @return true 表示回滚已先于部署完成开始，且回滚方未拿到该 ID，调用方需自行补偿
     */
    public synchronized boolean recordNewDeployment(String versionLabel, String deploymentId) {
        deploymentIds.put(versionLabel, deploymentId);
        return rollbackStarted && rollbackDeploymentId == null;
    }

    /**
     * 正向调整流量
     *
     * @return false 表示回滚已开始或阶段转换被拒绝，流量未变化
     */
    public synchronized boolean shiftTraffic(int percentage, int targetPhaseIndex, RolloutPhase phase) {
        if (rollbackStarted || abortRequested) {
            return false;
        }
        if (percentage < currentTrafficPercentage) {
            throw new IllegalStateException("流量只能递增: " + currentTrafficPercentage + " -> " + percentage);
        }
        if (!stateMachine.transitionTo(phase, this)) {
            return false;
        }
        int maxIndex = Math.max(0, config.getPhases().size() - 1);
        int clamped = Math.min(targetPhaseIndex, maxIndex);
        if (clamped > phaseIndex) {
            phaseIndex = clamped;
        }
        currentTrafficPercentage = percentage;
        phaseStartTime = Instant.now();
        return true;
    }

    public synchronized void appendSnapshot(MetricsSnapshot snapshot) {
        metricsHistory.add(snapshot);
    }

    public synchronized MetricsSnapshot latestSnapshot() {
        return metricsHistory.isEmpty() ? null : metricsHistory.get(metricsHistory.size() - 1);
    }

    public synchronized List<MetricsSnapshot> recentSnapshots(int count) {
        int from = Math.max(0, metricsHistory.size() - count);
        return new ArrayList<>(metricsHistory.subList(from, metricsHistory.size()));
    }

    public synchronized List<MetricsSnapshot> getMetricsHistory() {
        return new ArrayList<>(metricsHistory);
    }

    public synchronized void addError(String error) {
        errors.add(error);
    }

    public synchronized void setRollbackReasonIfAbsent(String reason) {
        if (rollbackReason == null) {
            rollbackReason = reason;
        }
    }

    /**
     * 登记中止请求
     *
     * @return false 表示发布已结束或已在回滚
     */
    public synchronized boolean requestAbort(String reason) {
        if (abortRequested || rollbackStarted || stateMachine.getCurrent().isTerminal()) {
            return false;
        }
        abortRequested = true;
        rollbackReason = (reason == null || reason.isBlank()) ? DEFAULT_ABORT_REASON : reason;
        return true;
    }

    /**
     * 进入 ROLLING_BACK 并把流量归零，同时锁定此刻已知的新版本部署 ID
     *
     * @return false 表示回滚已开始过或发布已结束
     */
    public synchronized boolean beginRollback(String reason) {
        if (rollbackStarted || stateMachine.getCurrent().isTerminal()) {
            return false;
        }
        if (!stateMachine.transitionTo(RolloutPhase.ROLLING_BACK, this)) {
            return false;
        }
        rollbackStarted = true;
        setRollbackReasonIfAbsent(reason);
        rollbackDeploymentId = deploymentIds.get(config.newVersionLabel());
        currentTrafficPercentage = 0;
        return true;
    }

    public synchronized boolean complete() {
        if (!stateMachine.transitionTo(RolloutPhase.COMPLETED, this)) {
            return false;
        }
        endTime = Instant.now();
        return true;
    }

    public synchronized boolean fail() {
        if (!stateMachine.transitionTo(RolloutPhase.FAILED, this)) {
            return false;
        }
        endTime = Instant.now();
        return true;
    }

    /**
     * 尚未开始执行（仍为 INITIALIZING）时记录错误并直接进入 FAILED
     *
     * @return false 表示执行线程已开始
     */
    public synchronized boolean failBeforeStart(String error) {
        if (stateMachine.getCurrent() != RolloutPhase.INITIALIZING) {
            return false;
        }
        errors.add(error);
        return fail();
    }

    public synchronized RolloutStateSnapshot snapshot() {
        return new RolloutStateSnapshot(rolloutId, config, stateMachine.getCurrent(), currentTrafficPercentage,
                phaseIndex, startTime, phaseStartTime, endTime, deploymentIds, metricsHistory, errors,
                rollbackReason, abortRequested);
    }

    public String getRolloutId() { return rolloutId; }
    public RolloutConfig getConfig() { return config; }
    public Instant getStartTime() { return startTime; }
    public synchronized RolloutPhase getCurrentPhase() { return stateMachine.getCurrent(); }
    public synchronized int getCurrentTrafficPercentage() { return currentTrafficPercentage; }
    public synchronized int getPhaseIndex() { return phaseIndex; }
    public synchronized String getNewDeploymentId() { return deploymentIds.get(config.newVersionLabel()); }
    public synchronized String getRollbackDeploymentId() { return rollbackDeploymentId; }
    public synchronized String getRollbackReason() { return rollbackReason; }
    public synchronized boolean isAbortRequested() { return abortRequested; }
    public synchronized boolean isRollbackStarted() { return rollbackStarted; }
    public synchronized List<String> getErrors() { return Collections.unmodifiableList(new ArrayList<>(errors)); }
}
