package com.aura.edge.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link EngineConfig}.
 */
class EngineConfigTest {

    @Test
    @DisplayName("environment values override the defaults")
    void fromMap_readsValues() {
        EngineConfig config = EngineConfig.fromMap(Map.of(
            EngineConfig.ENV_DB_PATH, "/tmp/aura-test.db",
            EngineConfig.ENV_TICK_MILLIS, "250",
            EngineConfig.ENV_METRICS_WINDOW_SECONDS, "30",
            EngineConfig.ENV_CHECKPOINT_SECONDS, "10",
            EngineConfig.ENV_NATIVE_INPUT, "false"
        ));

        assertEquals(Path.of("/tmp/aura-test.db"), config.dbPath());
        assertEquals(Duration.ofMillis(250), config.tickPeriod());
        assertEquals(Duration.ofSeconds(30), config.metricsWindow());
        assertEquals(Duration.ofSeconds(10), config.checkpointInterval());
        assertEquals(EngineConfig.DEFAULT_IDLE_ZERO, config.idleZeroThreshold());
        assertFalse(config.nativeInput());
    }

    @Test
    @DisplayName("an empty environment gives the defaults under the home directory")
    void fromMap_empty_usesDefaults() {
        EngineConfig config = EngineConfig.fromMap(Map.of());

        assertEquals(Path.of(System.getProperty("user.home"), ".aura", "aura.db"), config.dbPath());
        assertEquals(EngineConfig.DEFAULT_TICK, config.tickPeriod());
        assertTrue(config.nativeInput());
    }

    @Test
    @DisplayName("garbage and non-positive numbers fall back to the default")
    void fromMap_invalidNumbers_fallBack() {
        EngineConfig config = EngineConfig.fromMap(Map.of(
            EngineConfig.ENV_TICK_MILLIS, "fast",
            EngineConfig.ENV_CHECKPOINT_SECONDS, "0",
            EngineConfig.ENV_IDLE_ZERO_SECONDS, "-3"
        ));

        assertEquals(EngineConfig.DEFAULT_TICK, config.tickPeriod());
        assertEquals(EngineConfig.DEFAULT_CHECKPOINT, config.checkpointInterval());
        assertEquals(EngineConfig.DEFAULT_IDLE_ZERO, config.idleZeroThreshold());
    }
}
