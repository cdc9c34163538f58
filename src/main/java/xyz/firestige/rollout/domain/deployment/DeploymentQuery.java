package xyz.firestige.rollout.domain.deployment;

/**
 * 部署历史查询条件：按服务名 / 状态过滤，按开始时间倒序，最多返回 limit 条
 */
public final class DeploymentQuery {

    public static final int DEFAULT_LIMIT = 50;

    private final String serviceName;
    private final DeploymentStatus status;
    private final int limit;

    private DeploymentQuery(String serviceName, DeploymentStatus status, int limit) {
        this.serviceName = serviceName;
        this.status = status;
        this.limit = limit;
    }

    public static DeploymentQuery all() {
        return new DeploymentQuery(null, null, DEFAULT_LIMIT);
    }

    public DeploymentQuery service(String serviceName) {
        return new DeploymentQuery(serviceName, status, limit);
    }

    public DeploymentQuery status(DeploymentStatus status) {
        return new DeploymentQuery(serviceName, status, limit);
    }

    public DeploymentQuery limit(int limit) {
        return new DeploymentQuery(serviceName, status, limit);
    }

    public boolean matches(DeploymentResult result) {
        if (serviceName != null && !serviceName.equals(result.getServiceName())) {
            return false;
        }
        return status == null || status == result.getStatus();
    }

    public String getServiceName() { return serviceName; }
    public DeploymentStatus getStatus() { return status; }
    public int getLimit() { return limit; }
}
