package com.aura.shared;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Session or timer operation a schedule rule can trigger.
 */
public enum ScheduleAction {
    PAUSE("pause", "Pause"),
    RESUME("resume", "Resume"),
    RESET("reset", "Reset"),
    START_SESSION("start_session", "Start session"),
    END_SESSION("end_session", "End session");

    private final String wireName;
    private final String label;

    ScheduleAction(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String label() {
        return label;
    }

    public static Optional<ScheduleAction> fromWire(String name) {
        for (ScheduleAction action : values()) {
            if (action.wireName.equalsIgnoreCase(name)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
