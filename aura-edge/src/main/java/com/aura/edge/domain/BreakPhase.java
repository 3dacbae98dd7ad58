package com.aura.edge.domain;

import java.util.Locale;

public enum BreakPhase {
    IDLE,
    FIRED_PENDING,
    RESOLVED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
