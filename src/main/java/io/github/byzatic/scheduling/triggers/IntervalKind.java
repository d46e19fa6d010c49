package io.github.byzatic.scheduling.triggers;

/**
 * Anchor the trigger interval is measured from.
 */
public enum IntervalKind {
    /**
     * Next fire = previous fire start + interval. Executions may overlap.
     */
    START_TO_START,
    /**
     * Next fire = previous fire end + interval. Fires never overlap.
     */
    END_TO_START
}
