package com.aura.shared;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActivityState {
    ACTIVE,
    IDLE,
    /** Fullscreen or block-listed foreground app. */
    IMMERSIVE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
