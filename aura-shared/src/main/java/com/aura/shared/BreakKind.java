package com.aura.shared;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The three independent break reminders. Declaration order is firing priority:
 * when several timers are due in the same tick, the earliest constant wins.
 */
public enum BreakKind {
    MACRO("macro", "#F59E0B"),
    MICRO("micro", "#10B981"),
    HYDRATION("hydration", "#3B82F6");

    private final String wireName;
    private final String themeColor;

    BreakKind(String wireName, String themeColor) {
        this.wireName = wireName;
        this.themeColor = themeColor;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String themeColor() {
        return themeColor;
    }

    public static Optional<BreakKind> fromWire(String name) {
        for (BreakKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
