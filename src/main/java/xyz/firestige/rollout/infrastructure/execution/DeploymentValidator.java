package xyz.firestige.rollout.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.application.deployment.DeploymentAutomation;
import xyz.firestige.rollout.domain.deployment.DeploymentResult;
import xyz.firestige.rollout.domain.deployment.DeploymentStatus;
import xyz.firestige.rollout.domain.deployment.HealthCheckConfig;
import xyz.firestige.rollout.domain.deployment.HealthCheckRecord;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.infrastructure.health.HealthCheckClient;

import java.util.Optional;

/**
 * 切流前的新版本校验：部署状态为 SUCCEEDED 且每个健康检查都通过
 * 每次探测结果都追加到部署的 healthCheckResults。
 */
public class DeploymentValidator {

    private static final Logger log = LoggerFactory.getLogger(DeploymentValidator.class);

    private final DeploymentAutomation deploymentAutomation;
    private final HealthCheckClient healthCheckClient;

    public DeploymentValidator(DeploymentAutomation deploymentAutomation, HealthCheckClient healthCheckClient) {
        this.deploymentAutomation = deploymentAutomation;
        this.healthCheckClient = healthCheckClient;
    }

    /**
     * @return 校验失败原因；通过时为空
     */
    public Optional<String> validate(RolloutState state) {
        String deploymentId = state.getNewDeploymentId();
        if (deploymentId == null) {
            return Optional.of("no deployment recorded for " + state.getConfig().newVersionLabel());
        }

        Optional<DeploymentResult> result = deploymentAutomation.getDeploymentStatus(deploymentId);
        if (result.isEmpty() || result.get().getStatus() != DeploymentStatus.SUCCEEDED) {
            String status = result.map(r -> r.getStatus().name()).orElse("UNKNOWN");
            log.warn("[DeploymentValidator] 新版本部署状态异常: deploymentId={}, status={}", deploymentId, status);
            return Optional.of("deployment " + deploymentId + " status " + status);
        }

        for (HealthCheckConfig check : state.getConfig().getDeploymentSpec().getHealthChecks()) {
            HealthCheckRecord record = healthCheckClient.probe(check);
            deploymentAutomation.recordHealthCheck(deploymentId, record);
            if (!record.isHealthy()) {
                log.warn("[DeploymentValidator] 健康检查未通过: deploymentId={}, check={}, detail={}",
                        deploymentId, check, record.getDetail());
                return Optional.of("health check " + check.getType() + " " + check.getEndpoint()
                        + " failed: " + record.getDetail());
            }
        }
        log.info("[DeploymentValidator] 新版本校验通过: deploymentId={}", deploymentId);
        return Optional.empty();
    }
}
