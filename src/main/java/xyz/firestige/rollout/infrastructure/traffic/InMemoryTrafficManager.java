package xyz.firestige.rollout.infrastructure.traffic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内流量表，保留每个服务的切分历史
 */
public class InMemoryTrafficManager implements TrafficManager {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTrafficManager.class);

    private final Map<String, List<Map<String, Integer>>> history = new ConcurrentHashMap<>();

    @Override
    public void setTrafficSplit(String serviceName, Map<String, Integer> versionWeights) {
        Map<String, Integer> copy = Collections.unmodifiableMap(new LinkedHashMap<>(versionWeights));
        List<Map<String, Integer>> splits = history.computeIfAbsent(serviceName, k -> new ArrayList<>());
        synchronized (splits) {
            splits.add(copy);
        }
        log.info("[InMemoryTrafficManager] 流量切分已更新: service={}, weights={}", serviceName, copy);
    }

    @Override
    public Map<String, Integer> getCurrentSplit(String serviceName) {
        List<Map<String, Integer>> splits = history.get(serviceName);
        if (splits == null) {
            return Collections.emptyMap();
        }
        synchronized (splits) {
            return splits.isEmpty() ? Collections.emptyMap() : splits.get(splits.size() - 1);
        }
    }

    /**
     * 某服务经历过的全部切分，按写入顺序
     */
    public List<Map<String, Integer>> getSplitHistory(String serviceName) {
        List<Map<String, Integer>> splits = history.get(serviceName);
        if (splits == null) {
            return Collections.emptyList();
        }
        synchronized (splits) {
            return new ArrayList<>(splits);
        }
    }
}
