package com.aura.edge.domain;

import com.aura.shared.BreakKind;
import com.aura.shared.SessionState;

import java.util.Map;

/**
 * Everything needed to resume the engine after a restart. Stored as one JSON document.
 *
 * @param pauseUntilMillis epoch millis of a timed reminder pause, {@code null} if none or indefinite
 * @param timers           per break kind, keyed by wire name
 */
public record EngineCheckpoint(
    SessionState sessionState,
    Long pauseUntilMillis,
    boolean remindersPaused,
    Map<String, TimerCheckpoint> timers,
    BreakKind pendingBreak
) {

    public record TimerCheckpoint(long elapsedMillis, BreakPhase phase, Long logId, Long trainingSampleId) {
    }
}
