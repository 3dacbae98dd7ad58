package com.aura.shared.protocol;

import java.util.Optional;

/**
 * Commands accepted from the host process. The wire tag travels in the {@code cmd} field.
 */
public enum CommandType {
    START_SESSION("start_session"),
    PAUSE_SESSION("pause_session"),
    RESUME_SESSION("resume_session"),
    END_SESSION("end_session"),
    GET_SESSION_STATE("get_session_state"),

    PAUSE_REMINDERS("pause_reminders", "pause"),
    RESUME_REMINDERS("resume_reminders", "resume"),

    COMPLETE_BREAK("complete_break"),
    SNOOZE_BREAK("snooze_break"),
    SKIP_BREAK("skip_break"),
    RESET_ALL_TIMERS("reset_all_timers"),

    LOG_HYDRATION("log_hydration"),
    GET_HYDRATION("get_hydration"),

    GET_STATUS("get_status"),
    GET_METRICS("get_metrics"),

    UPDATE_SETTING("update_setting"),
    GET_SETTINGS("get_settings"),

    ADD_SCHEDULE_RULE("add_schedule_rule"),
    UPDATE_SCHEDULE_RULE("update_schedule_rule"),
    DELETE_SCHEDULE_RULE("delete_schedule_rule"),
    GET_SCHEDULE_RULES("get_schedule_rules"),

    EXPORT_DATA("export_data"),
    GET_TRAINING_STATS("get_training_stats"),

    SHUTDOWN("shutdown");

    private final String wireName;
    private final String alias;

    CommandType(String wireName) {
        this(wireName, null);
    }

    CommandType(String wireName, String alias) {
        this.wireName = wireName;
        this.alias = alias;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<CommandType> fromWire(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (CommandType type : values()) {
            if (type.wireName.equals(name) || name.equals(type.alias)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
