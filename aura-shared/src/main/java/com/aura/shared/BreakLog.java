package com.aura.shared;

/**
 * One fired break and how it was resolved. All flags are false while the break is pending.
 *
 * @param timestamp epoch seconds when the break fired
 */
public record BreakLog(
    long id,
    long timestamp,
    BreakKind breakType,
    int durationSeconds,
    boolean completed,
    boolean skipped,
    boolean snoozed
) {
    public boolean isPending() {
        return !completed && !skipped && !snoozed;
    }
}
