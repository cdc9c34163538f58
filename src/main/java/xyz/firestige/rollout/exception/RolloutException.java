package xyz.firestige.rollout.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * 发布引擎基础异常类
 * 所有部署 / 发布相关异常的基类
 */
public class RolloutException extends RuntimeException {

    /**
     * 错误码
     */
    private String errorCode;

    /**
     * 错误类型
     */
    private ErrorType errorType;

    /**
     * 是否可重试
     */
    private boolean retryable;

    /**
     * 上下文信息
     */
    private final Map<String, Object> context = new HashMap<>();

    public RolloutException(String message) {
        super(message);
        this.errorType = ErrorType.SYSTEM_ERROR;
    }

    public RolloutException(String message, Throwable cause) {
        super(message, cause);
        this.errorType = ErrorType.SYSTEM_ERROR;
    }

    public RolloutException(ErrorType errorType, String message) {
        super(message);
        this.errorCode = errorType.name();
        this.errorType = errorType;
    }

    public RolloutException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorType.name();
        this.errorType = errorType;
    }

    public RolloutException(String errorCode, String message, ErrorType errorType) {
        super(message);
        this.errorCode = errorCode;
        this.errorType = errorType;
    }

    /**
     * 添加上下文信息
     */
    public RolloutException addContext(String key, Object value) {
        this.context.put(key, value);
        return this;
    }

    /**
     * 设置是否可重试
     */
    public RolloutException setRetryable(boolean retryable) {
        this.retryable = retryable;
        return this;
    }

    /**
     * 转换为 FailureInfo
     */
    public FailureInfo toFailureInfo() {
        FailureInfo info = new FailureInfo();
        info.setErrorCode(this.errorCode != null ? this.errorCode : this.errorType.name());
        info.setErrorMessage(this.getMessage());
        info.setErrorType(this.errorType);
        info.setRetryable(this.retryable);
        Object failedAt = context.get("phase");
        if (failedAt != null) {
            info.setFailedAt(String.valueOf(failedAt));
        }
        return info;
    }

    // Getters

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
