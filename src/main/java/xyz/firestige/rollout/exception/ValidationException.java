package xyz.firestige.rollout.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 校验异常
 * 部署规格或发布配置非法时抛出，保证在任何外部调用前失败
 */
public class ValidationException extends RolloutException {

    private final List<String> violations;

    public ValidationException(String message) {
        super(ErrorType.VALIDATION_ERROR, message);
        this.violations = Collections.singletonList(message);
    }

    public ValidationException(List<String> violations) {
        super(ErrorType.VALIDATION_ERROR, "校验失败: " + String.join("; ", violations));
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public List<String> getViolations() {
        return violations;
    }
}
