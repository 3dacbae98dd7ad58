package com.aura.edge.config;

import com.aura.edge.domain.TimerMode;
import com.aura.edge.gateway.CommandRejectedException;
import com.aura.edge.gateway.ProtocolMapper;
import com.aura.edge.scheduler.BreakConfig;
import com.aura.edge.service.DataStorageService;
import com.aura.edge.support.MutableClock;
import com.aura.shared.BreakKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link SettingsService}.
 */
class SettingsServiceTest {

    @TempDir
    Path tempDir;

    private DataStorageService store;
    private SettingsService settings;

    @BeforeEach
    void setUp() {
        store = new DataStorageService(tempDir.resolve("aura.db"), new MutableClock(), ProtocolMapper.create());
        settings = new SettingsService(store, ProtocolMapper.create());
    }

    @Test
    @DisplayName("defaults are readable through the typed accessors")
    void defaults_typedAccess() {
        assertEquals(new BreakConfig(1200, 20), settings.breakConfig(BreakKind.MICRO));
        assertEquals(new BreakConfig(2700, 180), settings.breakConfig(BreakKind.MACRO));
        assertEquals(TimerMode.WALL_CLOCK, settings.timerMode());
        assertEquals(Duration.ofSeconds(180), settings.idleThreshold());
        assertEquals(2000, settings.waterGoal());
        assertEquals(5, settings.blocklist().size());
    }

    @Test
    @DisplayName("an accepted value is stored in normalized form")
    void update_storesNormalizedValue() {
        Map.Entry<SettingKey, String> updated = settings.update("sound_enabled", " FALSE ");

        assertEquals(SettingKey.SOUND_ENABLED, updated.getKey());
        assertEquals("false", updated.getValue());
        assertEquals(Optional.of("false"), store.getSetting("sound_enabled"));
    }

    @Test
    @DisplayName("unknown keys are rejected without touching the store")
    void update_unknownKey_rejected() {
        assertThrows(CommandRejectedException.class, () -> settings.update("volume", "11"));
        assertFalse(store.getSetting("volume").isPresent());
    }

    @ParameterizedTest
    @CsvSource({
        "micro_break_interval, 0",
        "micro_break_interval, abc",
        "micro_break_duration, -1",
        "auto_detect_fullscreen, yes",
        "timer_mode, sometimes",
        "blocklist_processes, vlc.exe",
        "theme, '  '"
    })
    @DisplayName("values of the wrong shape are rejected")
    void normalize_invalid_rejected(String key, String value) {
        SettingKey setting = SettingKey.fromKey(key).orElseThrow();

        assertThrows(CommandRejectedException.class, () -> settings.normalize(setting, value));
    }

    @Test
    @DisplayName("zero is a valid break duration")
    void normalize_zeroDuration_accepted() {
        assertEquals("0", settings.normalize(SettingKey.MACRO_BREAK_DURATION, " 0"));
    }

    @Test
    @DisplayName("the blocklist is stored as a compact JSON array")
    void normalize_blocklist_reserialized() {
        String stored = settings.normalize(SettingKey.BLOCKLIST_PROCESSES, "[ \"vlc.exe\" , \"obs64.exe\" ]");

        assertEquals("[\"vlc.exe\",\"obs64.exe\"]", stored);
        settings.update("blocklist_processes", stored);
        assertEquals(List.of("vlc.exe", "obs64.exe"), settings.blocklist());
    }

    @Test
    @DisplayName("interval and duration keys map to their break kind")
    void breakKindOf_mapsIntervalKeys() {
        assertEquals(Optional.of(BreakKind.HYDRATION), SettingsService.breakKindOf(SettingKey.HYDRATION_INTERVAL));
        assertEquals(Optional.of(BreakKind.MACRO), SettingsService.breakKindOf(SettingKey.MACRO_BREAK_DURATION));
        assertEquals(Optional.empty(), SettingsService.breakKindOf(SettingKey.THEME));
    }
}
