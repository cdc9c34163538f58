package xyz.firestige.rollout.infrastructure.flag;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 特性开关状态
 */
public final class FeatureFlagStatus {

    private final String name;
    private final boolean enabled;
    private final int percentage;
    private final Map<String, Object> filters;

    public FeatureFlagStatus(String name, boolean enabled, int percentage, Map<String, Object> filters) {
        this.name = name;
        this.enabled = enabled;
        this.percentage = percentage;
        this.filters = Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    public static FeatureFlagStatus unknown(String name) {
        return new FeatureFlagStatus(name, false, 0, Collections.emptyMap());
    }

    public String getName() { return name; }
    public boolean isEnabled() { return enabled; }
    public int getPercentage() { return percentage; }
    public Map<String, Object> getFilters() { return filters; }

    @Override
    public String toString() {
        return "FeatureFlagStatus{" + name + " enabled=" + enabled + ", percentage=" + percentage + '}';
    }
}
