package xyz.firestige.rollout.application.rollout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.rollout.RolloutConfig;
import xyz.firestige.rollout.domain.rollout.RolloutPhase;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.rollout.RolloutRuntimeContext;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.domain.rollout.RolloutStateSnapshot;
import xyz.firestige.rollout.domain.shared.IdGenerator;
import xyz.firestige.rollout.exception.ErrorType;
import xyz.firestige.rollout.exception.FailureInfo;
import xyz.firestige.rollout.exception.RolloutException;
import xyz.firestige.rollout.exception.ValidationException;
import xyz.firestige.rollout.infrastructure.execution.RolloutExecutionDependencies;
import xyz.firestige.rollout.infrastructure.execution.RolloutExecutor;
import xyz.firestige.rollout.infrastructure.execution.strategy.RolloutRoutine;
import xyz.firestige.rollout.infrastructure.execution.strategy.RolloutRoutineRegistry;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 发布编排器
 * <p>
 * 职责：
 * 1. 校验发布配置，登记 RolloutState，为每个发布提交一个独立的 RolloutExecutor
 * 2. 中止发布：取消执行线程并同步完成补偿回滚
 * 3. 对外只返回状态快照
 * <p>
 * 线程池大小即同时运行的发布上限，超出的发布在队列中等待。
 */
public class RolloutOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(RolloutOrchestrator.class);

    private final RolloutRepository rolloutRepository;
    private final RolloutRoutineRegistry routineRegistry;
    private final RolloutExecutionDependencies dependencies;
    private final RolloutConfigValidator configValidator;
    private final ExecutorService executorService;
    private final Duration abortDeployWait;

    public RolloutOrchestrator(RolloutRepository rolloutRepository,
                               RolloutRoutineRegistry routineRegistry,
                               RolloutExecutionDependencies dependencies,
                               RolloutConfigValidator configValidator,
                               int maxConcurrentRollouts,
                               Duration abortDeployWait) {
        this.rolloutRepository = rolloutRepository;
        this.abortDeployWait = abortDeployWait;
        this.routineRegistry = routineRegistry;
        this.dependencies = dependencies;
        this.configValidator = configValidator;
        this.executorService = Executors.newFixedThreadPool(maxConcurrentRollouts, new RolloutThreadFactory());

        logger.info("[RolloutOrchestrator] 初始化完成，maxConcurrentRollouts: {}, 支持策略: {}",
                maxConcurrentRollouts, routineRegistry.supportedStrategies());
    }

    /**
     * 启动发布，立即返回 rolloutId
     *
     * @throws ValidationException 配置非法，此时不会登记任何状态
     */
    public String startRollout(RolloutConfig config) {
        List<String> violations = configValidator.validate(config);
        if (!violations.isEmpty()) {
            logger.warn("[RolloutOrchestrator] 发布配置校验失败: {}", violations);
            throw new ValidationException(violations);
        }

        RolloutRoutine routine = routineRegistry.get(config.getStrategy());
        String rolloutId = IdGenerator.next(config.getServiceName());
        RolloutRuntimeContext context = new RolloutRuntimeContext(new RolloutState(rolloutId, config));
        rolloutRepository.save(context);

        RolloutExecutor executor = new RolloutExecutor(context, routine, dependencies);
        try {
            Future<?> future = executorService.submit(executor::execute);
            context.setFuture(future);
        } catch (RejectedExecutionException e) {
            context.getState().addError(FailureInfo.of(ErrorType.SYSTEM_ERROR, "Rollout executor is shut down").toErrorEntry());
            context.getState().fail();
            throw new RolloutException(ErrorType.SYSTEM_ERROR, "Rollout executor is shut down", e);
        }

        logger.info("[RolloutOrchestrator] 发布已提交: rolloutId={}, service={}, strategy={}",
                rolloutId, config.getServiceName(), config.getStrategy());
        return rolloutId;
    }

    public Optional<RolloutStateSnapshot> getRolloutStatus(String rolloutId) {
        return rolloutRepository.find(rolloutId).map(RolloutState::snapshot);
    }

    /**
     * 中止发布
     * <p>
     * 先登记中止请求并唤醒执行线程，再在调用线程同步执行补偿回滚。
     * 新版本正在部署时先等待部署调用返回（至多 abortDeployWait），回滚时连同新部署一起撤销；
     * 等待超时则由执行线程在部署返回后补做部署回滚。
     * 执行线程此后在任何检查点都会安静退出，不会再写入正向流量。
     *
     * @return false 表示发布不存在、已结束或已在中止 / 回滚中
     */
    public boolean abortRollout(String rolloutId, String reason) {
        Optional<RolloutRuntimeContext> found = rolloutRepository.findContext(rolloutId);
        if (found.isEmpty()) {
            logger.warn("[RolloutOrchestrator] 中止失败，发布不存在: rolloutId={}", rolloutId);
            return false;
        }
        RolloutRuntimeContext context = found.get();
        RolloutState state = context.getState();
        if (!state.requestAbort(reason)) {
            logger.info("[RolloutOrchestrator] 发布已结束或已在回滚中，忽略中止: rolloutId={}, phase={}",
                    rolloutId, state.getCurrentPhase());
            return false;
        }

        state.addError(FailureInfo.of(ErrorType.ABORT_REQUESTED, state.getRollbackReason()).toErrorEntry());
        logger.info("[RolloutOrchestrator] 中止发布: rolloutId={}, reason={}", rolloutId, state.getRollbackReason());
        context.cancel();

        context.injectMdc();
        try {
            if (state.getCurrentPhase() == RolloutPhase.DEPLOYING) {
                awaitInFlightDeployment(context);
            }
            if (dependencies.getRollbackCoordinator().rollback(context, state.getRollbackReason())) {
                RolloutExecutor.recordDuration(context, dependencies.getMetrics(), "failure");
            }
        } finally {
            context.clearMdc();
        }
        return true;
    }

    private void awaitInFlightDeployment(RolloutRuntimeContext context) {
        logger.info("[RolloutOrchestrator] 新版本部署中，等待部署返回: rolloutId={}, 最长 {}",
                context.getRolloutId(), abortDeployWait);
        try {
            if (!context.awaitDeploySettled(abortDeployWait)) {
                logger.warn("[RolloutOrchestrator] 等待部署返回超时，由执行线程补做部署回滚: rolloutId={}",
                        context.getRolloutId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("[RolloutOrchestrator] 等待部署返回时被中断，由执行线程补做部署回滚: rolloutId={}",
                    context.getRolloutId());
        }
    }

    /**
     * 尚未结束的发布（含正在回滚的）
     */
    public List<RolloutStateSnapshot> listActiveRollouts() {
        return rolloutRepository.findAll().stream()
                .map(RolloutState::snapshot)
                .filter(RolloutStateSnapshot::isActive)
                .collect(Collectors.toList());
    }

    public List<RolloutStateSnapshot> listRollouts() {
        return rolloutRepository.findAll().stream()
                .map(RolloutState::snapshot)
                .collect(Collectors.toList());
    }

    /**
     * 停止线程池并中断运行中的发布；容器关闭时调用
     * <p>
     * 队列中尚未开始的发布不会再运行，直接标记为 FAILED。
     */
    public void shutdown() {
        List<Runnable> pending = executorService.shutdownNow();
        int drained = 0;
        for (RolloutRuntimeContext context : rolloutRepository.findAllContexts()) {
            String error = FailureInfo.of(ErrorType.SYSTEM_ERROR,
                    "Rollout executor shut down before the rollout started").toErrorEntry();
            if (context.getState().failBeforeStart(error)) {
                context.cancel();
                drained++;
            }
        }
        logger.info("[RolloutOrchestrator] 线程池已关闭，未开始的任务: {}，标记为失败的发布: {}", pending.size(), drained);
    }

    private static final class RolloutThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "rollout-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
