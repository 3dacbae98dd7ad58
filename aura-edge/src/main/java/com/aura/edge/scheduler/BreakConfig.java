package com.aura.edge.scheduler;

import com.aura.shared.BreakKind;

public record BreakConfig(int intervalSeconds, int durationSeconds) {

    public BreakConfig {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("interval must be positive: " + intervalSeconds);
        }
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("duration must not be negative: " + durationSeconds);
        }
    }

    public static BreakConfig defaults(BreakKind kind) {
        return switch (kind) {
            case MICRO -> new BreakConfig(1200, 20);
            case MACRO -> new BreakConfig(2700, 180);
            case HYDRATION -> new BreakConfig(1800, 0);
        };
    }
}
