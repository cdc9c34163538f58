package xyz.firestige.rollout.domain.deployment;

import java.util.Objects;

/**
 * 容器资源限制，取值沿用编排平台的写法（如 "500m"、"512Mi"）
 */
public final class ResourceLimits {

    private final String cpu;
    private final String memory;
    private final String disk;
    private final String networkBandwidth;

    public ResourceLimits(String cpu, String memory, String disk, String networkBandwidth) {
        this.cpu = cpu;
        this.memory = memory;
        this.disk = disk;
        this.networkBandwidth = networkBandwidth;
    }

    public static ResourceLimits defaults() {
        return new ResourceLimits("500m", "512Mi", null, null);
    }

    public String getCpu() { return cpu; }
    public String getMemory() { return memory; }
    public String getDisk() { return disk; }
    public String getNetworkBandwidth() { return networkBandwidth; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceLimits)) return false;
        ResourceLimits that = (ResourceLimits) o;
        return Objects.equals(cpu, that.cpu) && Objects.equals(memory, that.memory)
                && Objects.equals(disk, that.disk) && Objects.equals(networkBandwidth, that.networkBandwidth);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cpu, memory, disk, networkBandwidth);
    }

    @Override
    public String toString() {
        return "ResourceLimits{cpu='" + cpu + "', memory='" + memory + "'}";
    }
}
