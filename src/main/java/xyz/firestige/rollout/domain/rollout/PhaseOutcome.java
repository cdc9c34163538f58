package xyz.firestige.rollout.domain.rollout;

import java.util.Objects;

/**
 * 单个阶段步骤的结果，由执行循环解释：继续、提升到 100% 或失败
 */
public final class PhaseOutcome {

    public enum Kind { CONTINUE, PROMOTE, FAIL }

    private static final PhaseOutcome CONTINUE = new PhaseOutcome(Kind.CONTINUE, null);
    private static final PhaseOutcome PROMOTE = new PhaseOutcome(Kind.PROMOTE, null);

    private final Kind kind;
    private final String reason;

    private PhaseOutcome(Kind kind, String reason) {
        this.kind = kind;
        this.reason = reason;
    }

    public static PhaseOutcome proceed() {
        return CONTINUE;
    }

    public static PhaseOutcome promote() {
        return PROMOTE;
    }

    public static PhaseOutcome fail(String reason) {
        return new PhaseOutcome(Kind.FAIL, Objects.requireNonNull(reason, "reason"));
    }

    public Kind getKind() { return kind; }
    public String getReason() { return reason; }
    public boolean isFail() { return kind == Kind.FAIL; }
    public boolean isPromote() { return kind == Kind.PROMOTE; }

    @Override
    public String toString() {
        return reason == null ? kind.name() : kind + "(" + reason + ")";
    }
}
