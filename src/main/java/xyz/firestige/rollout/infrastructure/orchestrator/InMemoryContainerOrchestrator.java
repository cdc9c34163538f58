package xyz.firestige.rollout.infrastructure.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.deployment.DeploymentSpec;
import xyz.firestige.rollout.domain.deployment.DeploymentStatus;
import xyz.firestige.rollout.domain.shared.IdGenerator;
import xyz.firestige.rollout.exception.OrchestratorException;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * 进程内编排器：部署立即成功，记录每次部署与服务副本数
 * <p>
 * 可注入失败规则（{@link #failDeploymentsWhen(Predicate)}）模拟平台故障。
 */
public class InMemoryContainerOrchestrator implements ContainerOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(InMemoryContainerOrchestrator.class);

    private final Map<String, Deployment> deployments = new ConcurrentHashMap<>();
    private final Map<String, Integer> replicas = new ConcurrentHashMap<>();
    private final Map<String, String> activeDeployments = new ConcurrentHashMap<>();
    private volatile Predicate<DeploymentSpec> failurePredicate = spec -> false;

    @Override
    public String deploy(DeploymentSpec spec) {
        String deploymentId = IdGenerator.next(spec.getServiceName());
        Deployment deployment = new Deployment(deploymentId, spec, Instant.now());
        deployments.put(deploymentId, deployment);

        if (failurePredicate.test(spec)) {
            deployment.status = DeploymentStatus.FAILED;
            log.error("[InMemoryOrchestrator] 部署失败: deploymentId={}, image={}", deploymentId, spec.getImageReference());
            throw new OrchestratorException("Deployment failed for " + spec.getServiceName())
                    .addContext("deploymentId", deploymentId);
        }

        replicas.put(spec.getServiceName(), spec.getReplicas());
        activeDeployments.put(spec.getServiceName(), deploymentId);
        deployment.status = DeploymentStatus.SUCCEEDED;
        log.info("[InMemoryOrchestrator] 部署完成: deploymentId={}, image={}, replicas={}",
                deploymentId, spec.getImageReference(), spec.getReplicas());
        return deploymentId;
    }

    @Override
    public DeploymentStatus getDeploymentStatus(String deploymentId) {
        Deployment deployment = deploymentId == null ? null : deployments.get(deploymentId);
        return deployment == null ? DeploymentStatus.FAILED : deployment.status;
    }

    @Override
    public synchronized boolean rollback(String deploymentId) {
        Deployment current = deployments.get(deploymentId);
        if (current == null) {
            log.warn("[InMemoryOrchestrator] 回滚目标不存在: {}", deploymentId);
            return false;
        }
        Optional<Deployment> previous = findPreviousDeployment(current.spec.getServiceName(), deploymentId);
        if (previous.isEmpty()) {
            log.warn("[InMemoryOrchestrator] 服务 {} 没有可恢复的历史成功部署", current.spec.getServiceName());
            return false;
        }
        current.status = DeploymentStatus.ROLLING_BACK;
        Deployment restored = previous.get();
        activeDeployments.put(restored.spec.getServiceName(), restored.id);
        replicas.put(restored.spec.getServiceName(), restored.spec.getReplicas());
        current.status = DeploymentStatus.ROLLED_BACK;
        log.info("[InMemoryOrchestrator] 回滚完成: {} -> {}", deploymentId, restored.id);
        return true;
    }

    @Override
    public boolean scale(String serviceName, int replicaCount) {
        if (replicaCount < 0 || !activeDeployments.containsKey(serviceName)) {
            log.error("[InMemoryOrchestrator] 扩缩容失败: service={}, replicas={}", serviceName, replicaCount);
            return false;
        }
        replicas.put(serviceName, replicaCount);
        log.info("[InMemoryOrchestrator] 扩缩容完成: service={}, replicas={}", serviceName, replicaCount);
        return true;
    }

    private Optional<Deployment> findPreviousDeployment(String serviceName, String excludedId) {
        return deployments.values().stream()
                .filter(d -> d.spec.getServiceName().equals(serviceName))
                .filter(d -> !d.id.equals(excludedId))
                .filter(d -> d.status == DeploymentStatus.SUCCEEDED)
                .max(Comparator.comparing((Deployment d) -> d.startTime).thenComparing(d -> d.sequence));
    }

    public void failDeploymentsWhen(Predicate<DeploymentSpec> predicate) {
        this.failurePredicate = predicate;
    }

    public Optional<String> getActiveDeployment(String serviceName) {
        return Optional.ofNullable(activeDeployments.get(serviceName));
    }

    public Optional<Integer> getReplicas(String serviceName) {
        return Optional.ofNullable(replicas.get(serviceName));
    }

    private static final class Deployment {
        private static long counter;

        private final String id;
        private final DeploymentSpec spec;
        private final Instant startTime;
        // 同一时刻的两次部署按提交顺序区分先后
        private final long sequence;
        private volatile DeploymentStatus status = DeploymentStatus.IN_PROGRESS;

        private Deployment(String id, DeploymentSpec spec, Instant startTime) {
            this.id = id;
            this.spec = spec;
            this.startTime = startTime;
            synchronized (Deployment.class) {
                this.sequence = ++counter;
            }
        }
    }
}
