package xyz.firestige.rollout.application.deployment;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.deployment.DeploymentHistoryRepository;
import xyz.firestige.rollout.domain.deployment.DeploymentQuery;
import xyz.firestige.rollout.domain.deployment.DeploymentResult;
import xyz.firestige.rollout.domain.deployment.DeploymentSpec;
import xyz.firestige.rollout.domain.deployment.DeploymentStatus;
import xyz.firestige.rollout.domain.deployment.HealthCheckRecord;
import xyz.firestige.rollout.exception.ValidationException;
import xyz.firestige.rollout.infrastructure.hook.PostDeploymentHook;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollout.infrastructure.orchestrator.ContainerOrchestrator;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 部署自动化服务
 * <p>
 * 职责：
 * 1. 校验部署规格（失败时不产生任何外部调用）
 * 2. 通过 ContainerOrchestrator 执行部署 / 回滚 / 扩缩容
 * 3. 维护部署历史、执行部署后集成钩子、输出指标与追踪
 * <p>
 * 编排器抛出的异常在记录失败指标后原样抛给调用方。
 */
public class DeploymentAutomation {

    private static final Logger logger = LoggerFactory.getLogger(DeploymentAutomation.class);

    static final String DEPLOYMENT_TOTAL = "deployment_total";
    static final String DEPLOYMENT_ERRORS_TOTAL = "deployment_errors_total";
    static final String DEPLOYMENT_DURATION_SECONDS = "deployment_duration_seconds";
    static final String ROLLBACK_TOTAL = "rollback_total";

    private final ContainerOrchestrator orchestrator;
    private final DeploymentHistoryRepository historyRepository;
    private final DeploymentSpecValidator specValidator;
    private final List<PostDeploymentHook> hooks;
    private final MetricsRegistry metrics;
    private final ObservationRegistry observationRegistry;

    public DeploymentAutomation(ContainerOrchestrator orchestrator,
                                DeploymentHistoryRepository historyRepository,
                                DeploymentSpecValidator specValidator,
                                List<PostDeploymentHook> hooks,
                                MetricsRegistry metrics,
                                ObservationRegistry observationRegistry) {
        this.orchestrator = orchestrator;
        this.historyRepository = historyRepository;
        this.specValidator = specValidator;
        this.hooks = hooks != null ? new ArrayList<>(hooks) : new ArrayList<>();
        this.metrics = metrics;
        this.observationRegistry = observationRegistry;
    }

    /**
     * 部署一个服务版本
     *
     * @return 部署结果副本
     * @throws ValidationException 规格非法
     */
    public DeploymentResult deployService(DeploymentSpec spec) {
        // Step 1: 规格校验（快速失败）
        List<String> violations = specValidator.validate(spec);
        if (!violations.isEmpty()) {
            ValidationException ex = new ValidationException(violations);
            String service = spec != null && spec.getServiceName() != null ? spec.getServiceName() : "unknown";
            logger.warn("[DeploymentAutomation] 部署规格校验失败: service={}, violations={}", service, violations);
            recordError(service, ex);
            throw ex;
        }

        logger.info("[DeploymentAutomation] 开始部署: service={}, image={}, replicas={}, strategy={}",
                spec.getServiceName(), spec.getImageReference(), spec.getReplicas(), spec.getStrategy());

        // Step 2: 在追踪 span 内调用编排器
        return Observation.createNotStarted("deploy_service", observationRegistry)
                .lowCardinalityKeyValue("service", spec.getServiceName())
                .lowCardinalityKeyValue("strategy", spec.getStrategy().name().toLowerCase())
                .lowCardinalityKeyValue("replicas", String.valueOf(spec.getReplicas()))
                .observe(() -> doDeploy(spec));
    }

    private DeploymentResult doDeploy(DeploymentSpec spec) {
        String service = spec.getServiceName();
        Instant startTime = Instant.now();
        String deploymentId;
        try {
            deploymentId = orchestrator.deploy(spec);
        } catch (RuntimeException e) {
            logger.error("[DeploymentAutomation] 部署失败: service={}, image={}", service, spec.getImageReference(), e);
            recordError(service, e);
            throw e;
        }

        // Step 3: 根据编排器状态构建结果
        DeploymentStatus status = orchestrator.getDeploymentStatus(deploymentId);
        DeploymentResult result = new DeploymentResult(deploymentId, service, spec.getStrategy(), status, startTime);
        if (status == DeploymentStatus.FAILED) {
            result.setErrorMessage("Orchestrator reported FAILED for " + deploymentId);
        }

        // Step 4: 部署后集成（失败不影响部署结果）
        if (status == DeploymentStatus.SUCCEEDED) {
            runPostDeploymentHooks(spec, deploymentId);
        }

        // Step 5: 写入历史 + 指标
        historyRepository.append(result);
        metrics.incrementCounter(DEPLOYMENT_TOTAL, Map.of("service", service, "status", status.name()));
        Duration duration = result.getDuration();
        if (duration != null) {
            metrics.recordHistogram(DEPLOYMENT_DURATION_SECONDS, duration.toMillis() / 1000.0,
                    Map.of("service", service, "strategy", spec.getStrategy().name().toLowerCase()));
        }

        logger.info("[DeploymentAutomation] 部署结束: deploymentId={}, status={}", deploymentId, status);
        return result.copy();
    }

    private void runPostDeploymentHooks(DeploymentSpec spec, String deploymentId) {
        for (PostDeploymentHook hook : hooks) {
            try {
                hook.afterDeployment(spec, deploymentId);
                logger.debug("[DeploymentAutomation] 部署后集成完成: hook={}, deploymentId={}", hook.name(), deploymentId);
            } catch (Exception e) {
                logger.error("[DeploymentAutomation] 部署后集成失败: hook={}, deploymentId={}", hook.name(), deploymentId, e);
            }
        }
    }

    private void recordError(String service, Exception e) {
        metrics.incrementCounter(DEPLOYMENT_ERRORS_TOTAL,
                Map.of("service", service, "error_type", e.getClass().getSimpleName()));
    }

    /**
     * 回滚到同服务上一次成功的部署
     *
     * @return 编排器是否完成回滚；编排器异常时返回 false
     */
    public boolean rollbackService(String deploymentId, String reason) {
        logger.info("[DeploymentAutomation] 开始回滚: deploymentId={}, reason={}", deploymentId, reason);
        boolean success;
        try {
            success = Observation.createNotStarted("rollback_service", observationRegistry)
                    .highCardinalityKeyValue("deployment_id", deploymentId)
                    .highCardinalityKeyValue("reason", reason == null ? "" : reason)
                    .observe(() -> orchestrator.rollback(deploymentId));
        } catch (RuntimeException e) {
            logger.error("[DeploymentAutomation] 回滚异常: deploymentId={}", deploymentId, e);
            success = false;
        }

        if (success) {
            historyRepository.find(deploymentId).ifPresent(r -> {
                r.setRollbackReason(reason);
                r.updateStatus(orchestrator.getDeploymentStatus(deploymentId));
            });
        } else {
            logger.warn("[DeploymentAutomation] 回滚未完成: deploymentId={}", deploymentId);
        }
        metrics.incrementCounter(ROLLBACK_TOTAL, Map.of("deployment_id", deploymentId, "success", String.valueOf(success)));
        return success;
    }

    /**
     * 查询部署结果，并用编排器的当前状态刷新
     */
    public Optional<DeploymentResult> getDeploymentStatus(String deploymentId) {
        return historyRepository.find(deploymentId).map(r -> {
            r.updateStatus(orchestrator.getDeploymentStatus(deploymentId));
            return r.copy();
        });
    }

    public List<DeploymentResult> listDeployments(DeploymentQuery query) {
        return historyRepository.query(query).stream()
                .map(DeploymentResult::copy)
                .collect(Collectors.toList());
    }

    /**
     * 扩缩容，尽力而为，不抛异常
     */
    public boolean scaleService(String serviceName, int replicas) {
        if (replicas < 0) {
            logger.warn("[DeploymentAutomation] 非法副本数: service={}, replicas={}", serviceName, replicas);
            return false;
        }
        try {
            boolean scaled = orchestrator.scale(serviceName, replicas);
            logger.info("[DeploymentAutomation] 扩缩容: service={}, replicas={}, success={}", serviceName, replicas, scaled);
            return scaled;
        } catch (RuntimeException e) {
            logger.error("[DeploymentAutomation] 扩缩容异常: service={}", serviceName, e);
            return false;
        }
    }

    /**
     * 追加一条健康探测记录
     */
    public void recordHealthCheck(String deploymentId, HealthCheckRecord record) {
        historyRepository.find(deploymentId).ifPresent(r -> r.appendHealthCheck(record));
    }
}
