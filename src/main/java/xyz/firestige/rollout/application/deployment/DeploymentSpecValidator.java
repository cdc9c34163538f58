package xyz.firestige.rollout.application.deployment;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import xyz.firestige.rollout.domain.deployment.DeploymentSpec;
import xyz.firestige.rollout.domain.deployment.HealthCheckConfig;
import xyz.firestige.rollout.domain.deployment.HealthCheckType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * 部署规格校验：注解约束 + HTTP 健康检查 URL 协议
 */
public class DeploymentSpecValidator {

    private final Validator validator;

    public DeploymentSpecValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * @return 违规描述列表，空列表表示通过
     */
    public List<String> validate(DeploymentSpec spec) {
        List<String> violations = new ArrayList<>();
        if (spec == null) {
            violations.add("Deployment spec is required");
            return violations;
        }

        Set<ConstraintViolation<DeploymentSpec>> constraintViolations = validator.validate(spec);
        constraintViolations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .forEach(v -> violations.add(String.format("[%s] %s", v.getPropertyPath(), v.getMessage())));

        for (HealthCheckConfig check : spec.getHealthChecks()) {
            if (check.getType() == HealthCheckType.HTTP && !isHttpUrl(check.getEndpoint())) {
                violations.add("Invalid HTTP health check endpoint: " + check.getEndpoint());
            }
        }
        return violations;
    }

    private boolean isHttpUrl(String endpoint) {
        return endpoint != null && (endpoint.startsWith("http://") || endpoint.startsWith("https://"))
                && endpoint.length() > endpoint.indexOf("://") + 3;
    }
}
