package xyz.firestige.rollout.exception;

/**
 * 容器编排平台异常（deploy / scale / rollback 失败）
 */
public class OrchestratorException extends RolloutException {

    public OrchestratorException(String message) {
        super(ErrorType.ORCHESTRATOR_ERROR, message);
        setRetryable(true);
    }

    public OrchestratorException(String message, Throwable cause) {
        super(ErrorType.ORCHESTRATOR_ERROR, message, cause);
        setRetryable(true);
    }
}
