package com.aura.shared.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Events emitted to the host process; serialized as the {@code type} tag.
 */
public enum EventType {
    READY,
    SHUTDOWN_ACK,
    SHUTDOWN,
    ERROR,

    METRICS,
    STATUS,
    STATE_CHANGE,

    SESSION_STARTED,
    SESSION_PAUSED,
    SESSION_RESUMED,
    SESSION_ENDED,
    SESSION_STATE,
    REMINDERS_PAUSED,
    REMINDERS_RESUMED,

    BREAK_DUE,
    BREAK_COMPLETED,
    BREAK_SNOOZED,
    BREAK_SKIPPED,
    TIMERS_RESET,

    HYDRATION_LOGGED,
    HYDRATION_STATUS,

    SETTINGS,
    SETTING_UPDATED,

    SCHEDULE_RULES,
    SCHEDULE_RULE_ADDED,
    SCHEDULE_RULE_UPDATED,
    SCHEDULE_RULE_DELETED,
    SCHEDULE_WARNING,
    SCHEDULE_ACTION_EXECUTED,

    DATA_EXPORTED,
    TRAINING_STATS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
