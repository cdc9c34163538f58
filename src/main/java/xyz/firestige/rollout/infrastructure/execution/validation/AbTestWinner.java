package xyz.firestige.rollout.infrastructure.execution.validation;

public enum AbTestWinner {
    NEW,
    OLD
}
