package xyz.firestige.rollout.domain.deployment;

public enum HealthCheckType {
    HTTP,
    TCP,
    EXEC,
    GRPC
}
