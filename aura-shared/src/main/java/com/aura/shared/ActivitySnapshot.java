package com.aura.shared;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rolling-window view of user input, recomputed every tick and never persisted.
 *
 * @param mouseVelocity  pixels per second over the sampling window
 * @param keysPerMinute  key presses in the window scaled to one minute
 * @param activeSeconds  accumulated seconds spent in the active state
 * @param idleSeconds    seconds since the last input event
 * @param foregroundApp  foreground process name, empty when unknown
 * @param fullscreen     whether the foreground window covers the screen
 */
public record ActivitySnapshot(
    double mouseVelocity,
    int keysPerMinute,
    long activeSeconds,
    long idleSeconds,
    ActivityState state,
    String foregroundApp,
    @JsonProperty("is_fullscreen") boolean fullscreen
) {
    public ActivitySnapshot {
        if (foregroundApp == null) {
            foregroundApp = "";
        }
    }

    public boolean isImmersive() {
        return state == ActivityState.IMMERSIVE;
    }
}
