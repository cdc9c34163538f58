package xyz.firestige.rollout.domain.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.domain.rollout.RolloutPhase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 发布阶段状态机
 * <p>
 * INITIALIZING → DEPLOYING → MONITORING ⇄ VALIDATING → PROMOTING → COMPLETED，
 * 任一活动阶段可进入 FAILED 或 ROLLING_BACK，ROLLING_BACK 只能进入 FAILED。
 * 同状态转换视为空操作并返回成功。
 *
 * @param <C> 守卫上下文
 */
public class RolloutStateMachine<C> {

    private static final Logger log = LoggerFactory.getLogger(RolloutStateMachine.class);

    private RolloutPhase current;

    private final Map<RolloutPhase, Set<RolloutPhase>> rules = new EnumMap<>(RolloutPhase.class);
    private final Map<RolloutPhase, List<TransitionGuard<C>>> guards = new EnumMap<>(RolloutPhase.class);

    public RolloutStateMachine(RolloutPhase initial) {
        this.current = initial;
        initRules();
    }

    private void initRules() {
        Set<RolloutPhase> forward = EnumSet.of(RolloutPhase.MONITORING, RolloutPhase.VALIDATING,
                RolloutPhase.PROMOTING, RolloutPhase.COMPLETED, RolloutPhase.FAILED, RolloutPhase.ROLLING_BACK);
        rules.put(RolloutPhase.INITIALIZING, EnumSet.of(RolloutPhase.DEPLOYING, RolloutPhase.ROLLING_BACK, RolloutPhase.FAILED));
        rules.put(RolloutPhase.DEPLOYING, forward);
        rules.put(RolloutPhase.MONITORING, forward);
        rules.put(RolloutPhase.VALIDATING, forward);
        rules.put(RolloutPhase.PROMOTING, forward);
        rules.put(RolloutPhase.ROLLING_BACK, EnumSet.of(RolloutPhase.FAILED));
        rules.put(RolloutPhase.COMPLETED, EnumSet.noneOf(RolloutPhase.class));
        rules.put(RolloutPhase.FAILED, EnumSet.noneOf(RolloutPhase.class));
    }

    /**
     * 为进入 target 的所有转换注册守卫
     */
    public void registerGuard(RolloutPhase target, TransitionGuard<C> guard) {
        guards.computeIfAbsent(target, k -> new ArrayList<>()).add(guard);
    }

    public synchronized boolean canTransition(RolloutPhase to, C ctx) {
        if (current == to) return true;
        Set<RolloutPhase> allowed = rules.getOrDefault(current, Collections.emptySet());
        if (!allowed.contains(to)) return false;
        List<TransitionGuard<C>> gs = guards.get(to);
        if (gs != null) {
            for (TransitionGuard<C> g : gs) {
                if (!g.canTransition(ctx)) return false;
            }
        }
        return true;
    }

    /**
     * @return 转换是否生效
     */
    public synchronized boolean transitionTo(RolloutPhase to, C ctx) {
        if (!canTransition(to, ctx)) {
            log.debug("[RolloutStateMachine] 拒绝状态转换: {} -> {}", current, to);
            return false;
        }
        current = to;
        return true;
    }

    public synchronized RolloutPhase getCurrent() { return current; }
}
