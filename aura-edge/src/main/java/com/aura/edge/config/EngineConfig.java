package com.aura.edge.config;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Process-level configuration, read once at startup. User-facing preferences live in the
 * settings table instead (see {@link SettingKey}).
 *
 * @param dbPath               SQLite database file
 * @param tickPeriod           period of the engine tick loop
 * @param idleZeroThreshold    input silence after which velocity and key rate read zero
 * @param metricsWindow        sliding window for velocity and key rate
 * @param checkpointInterval   how often timer progress is checkpointed between transitions
 * @param nativeInput          whether to install the OS-wide keyboard and mouse hook
 */
@Slf4j
public record EngineConfig(
    Path dbPath,
    Duration tickPeriod,
    Duration idleZeroThreshold,
    Duration metricsWindow,
    Duration checkpointInterval,
    boolean nativeInput
) {
    public static final String ENV_DB_PATH = "AURA_DB_PATH";
    public static final String ENV_TICK_MILLIS = "AURA_TICK_MILLIS";
    public static final String ENV_IDLE_ZERO_SECONDS = "AURA_IDLE_ZERO_SECONDS";
    public static final String ENV_METRICS_WINDOW_SECONDS = "AURA_METRICS_WINDOW_SECONDS";
    public static final String ENV_CHECKPOINT_SECONDS = "AURA_CHECKPOINT_SECONDS";
    public static final String ENV_NATIVE_INPUT = "AURA_NATIVE_INPUT";

    public static final Duration DEFAULT_TICK = Duration.ofSeconds(1);
    public static final Duration DEFAULT_IDLE_ZERO = Duration.ofSeconds(1);
    public static final Duration DEFAULT_METRICS_WINDOW = Duration.ofSeconds(60);
    public static final Duration DEFAULT_CHECKPOINT = Duration.ofSeconds(30);

    public static EngineConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    static EngineConfig fromMap(Map<String, String> env) {
        String dbPath = env.get(ENV_DB_PATH);
        Path db = dbPath == null || dbPath.isBlank()
            ? Path.of(System.getProperty("user.home"), ".aura", "aura.db")
            : Path.of(dbPath);

        return new EngineConfig(
            db,
            Duration.ofMillis(readLong(env, ENV_TICK_MILLIS, DEFAULT_TICK.toMillis())),
            Duration.ofSeconds(readLong(env, ENV_IDLE_ZERO_SECONDS, DEFAULT_IDLE_ZERO.toSeconds())),
            Duration.ofSeconds(readLong(env, ENV_METRICS_WINDOW_SECONDS, DEFAULT_METRICS_WINDOW.toSeconds())),
            Duration.ofSeconds(readLong(env, ENV_CHECKPOINT_SECONDS, DEFAULT_CHECKPOINT.toSeconds())),
            !"false".equalsIgnoreCase(env.get(ENV_NATIVE_INPUT))
        );
    }

    public static EngineConfig defaults(Path dbPath) {
        return new EngineConfig(dbPath, DEFAULT_TICK, DEFAULT_IDLE_ZERO, DEFAULT_METRICS_WINDOW,
            DEFAULT_CHECKPOINT, false);
    }

    private static long readLong(Map<String, String> env, String name, long fallback) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}, not a number; using {}", name, raw, fallback);
            return fallback;
        }
        if (value <= 0) {
            log.warn("Ignoring {}={}, expected a positive value; using {}", name, raw, fallback);
            return fallback;
        }
        return value;
    }
}
