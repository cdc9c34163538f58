package xyz.firestige.rollout.exception;

import java.time.LocalDateTime;

/**
 * 失败信息封装类
 * 统一封装发布过程中的失败信息，写入 RolloutState.errors
 */
public class FailureInfo {

    /**
     * 错误码
     */
    private String errorCode;

    /**
     * 错误消息
     */
    private String errorMessage;

    /**
     * 错误类型
     */
    private ErrorType errorType;

    /**
     * 失败位置（阶段名称）
     */
    private String failedAt;

    /**
     * 失败时间
     */
    private LocalDateTime timestamp;

    /**
     * 是否可重试
     */
    private boolean retryable;

    public FailureInfo() {
        this.timestamp = LocalDateTime.now();
    }

    public FailureInfo(String errorCode, String errorMessage, ErrorType errorType) {
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
        this.errorType = errorType;
        this.timestamp = LocalDateTime.now();
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage) {
        return new FailureInfo(errorType.name(), errorMessage, errorType);
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage, String failedAt) {
        FailureInfo info = new FailureInfo(errorType.name(), errorMessage, errorType);
        info.setFailedAt(failedAt);
        return info;
    }

    public static FailureInfo fromException(Exception e, ErrorType errorType, String failedAt) {
        if (e instanceof RolloutException) {
            FailureInfo info = ((RolloutException) e).toFailureInfo();
            if (info.getFailedAt() == null) {
                info.setFailedAt(failedAt);
            }
            return info;
        }
        FailureInfo info = new FailureInfo();
        info.setErrorCode(errorType.name());
        info.setErrorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        info.setErrorType(errorType);
        info.setFailedAt(failedAt);
        info.setRetryable(isRetryableException(e));
        return info;
    }

    private static boolean isRetryableException(Exception e) {
        // 网络类异常通常可重试
        String className = e.getClass().getName();
        return className.contains("Timeout") ||
               className.contains("Network") ||
               className.contains("Connection");
    }

    /**
     * 写入 RolloutState.errors 的单行摘要："ERROR_TYPE: message"
     */
    public String toErrorEntry() {
        return errorType.name() + ": " + errorMessage;
    }

    // Getters and Setters

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public void setErrorType(ErrorType errorType) {
        this.errorType = errorType;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(String failedAt) {
        this.failedAt = failedAt;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public void setRetryable(boolean retryable) {
        this.retryable = retryable;
    }

    @Override
    public String toString() {
        return "FailureInfo{" +
                "errorCode='" + errorCode + '\'' +
                ", errorMessage='" + errorMessage + '\'' +
                ", errorType=" + errorType +
                ", failedAt='" + failedAt + '\'' +
                ", timestamp=" + timestamp +
                ", retryable=" + retryable +
                '}';
    }
}
