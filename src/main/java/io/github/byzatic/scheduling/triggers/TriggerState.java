package io.github.byzatic.scheduling.triggers;

/**
 * Trigger lifecycle states.
 */
public enum TriggerState {
    PENDING,
    ACTIVE,
    DISABLED,
    CANCELLED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == CANCELLED || this == EXHAUSTED;
    }
}
