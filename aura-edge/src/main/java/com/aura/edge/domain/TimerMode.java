package com.aura.edge.domain;

import java.util.Optional;

public enum TimerMode {
    // only time spent actively working counts
    ACTIVE("active"),
    WALL_CLOCK("wall-clock");

    private final String wireName;

    TimerMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<TimerMode> fromWire(String name) {
        for (TimerMode mode : values()) {
            if (mode.wireName.equalsIgnoreCase(name)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
