package com.aura.shared;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Work session states. Break timers only run while the session is {@link #ACTIVE}.
 */
public enum SessionState {
    IDLE,
    ACTIVE,
    PAUSED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SessionState> fromWire(String name) {
        for (SessionState state : values()) {
            if (state.wireName().equalsIgnoreCase(name)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
