package com.aura.edge.monitor;

import java.util.Locale;

/**
 * Platform hook for finding the focused application. Implementations may throw;
 * the sampler treats any failure as {@link ForegroundWindow#UNKNOWN}.
 */
@FunctionalInterface
public interface ForegroundWindowProbe {

    ForegroundWindow probe() throws Exception;

    static ForegroundWindowProbe none() {
        return () -> ForegroundWindow.UNKNOWN;
    }

    static ForegroundWindowProbe forCurrentOs() {
        return forOs(System.getProperty("os.name", ""));
    }

    static ForegroundWindowProbe forOs(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.startsWith("windows")) {
            return new WindowsForegroundProbe();
        }
        if (os.contains("mac")) {
            return new OsascriptForegroundProbe();
        }
        return none();
    }
}
