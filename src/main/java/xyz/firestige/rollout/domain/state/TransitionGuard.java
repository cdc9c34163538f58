package xyz.firestige.rollout.domain.state;

/**
 * 状态转换守卫：返回 false 时拒绝转换
 */
@FunctionalInterface
public interface TransitionGuard<C> {
    boolean canTransition(C context);
}
