package com.aura.edge.config;

import com.aura.edge.domain.TimerMode;
import com.aura.edge.gateway.CommandRejectedException;
import com.aura.edge.scheduler.BreakConfig;
import com.aura.edge.service.DataStorageService;
import com.aura.shared.BreakKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to user settings stored in the settings table, plus validation of
 * incoming {@code update_setting} values.
 */
@Slf4j
public class SettingsService {

    private final DataStorageService store;
    private final ObjectMapper objectMapper;

    public SettingsService(DataStorageService store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    /**
     * Validates and stores a setting.
     *
     * @return the setting and the normalized value that was stored
     * @throws CommandRejectedException for unknown keys or values of the wrong shape
     */
    public Map.Entry<SettingKey, String> update(String key, String value) {
        SettingKey setting = SettingKey.fromKey(key)
            .orElseThrow(() -> new CommandRejectedException("Unknown setting '" + key + "'"));
        String normalized = normalize(setting, value);
        store.setSetting(setting.key(), normalized);
        log.info("Setting {} = {}", setting.key(), normalized);
        return Map.entry(setting, normalized);
    }

    String normalize(SettingKey setting, String value) {
        if (value == null) {
            throw new CommandRejectedException("Setting '" + setting.key() + "' needs a value");
        }
        String trimmed = value.trim();
        switch (setting.kind()) {
            case POSITIVE_INT, NON_NEGATIVE_INT -> {
                int parsed;
                try {
                    parsed = Integer.parseInt(trimmed);
                } catch (NumberFormatException e) {
                    throw new CommandRejectedException("Setting '" + setting.key() + "' must be a whole number, got '" + value + "'");
                }
                int minimum = setting.kind() == SettingKey.ValueKind.POSITIVE_INT ? 1 : 0;
                if (parsed < minimum) {
                    throw new CommandRejectedException("Setting '" + setting.key() + "' must be at least " + minimum);
                }
                return Integer.toString(parsed);
            }
            case BOOLEAN -> {
                String lower = trimmed.toLowerCase(Locale.ROOT);
                if (!lower.equals("true") && !lower.equals("false")) {
                    throw new CommandRejectedException("Setting '" + setting.key() + "' must be true or false");
                }
                return lower;
            }
            case CHOICE -> {
                if (!setting.choices().contains(trimmed)) {
                    throw new CommandRejectedException("Setting '" + setting.key() + "' must be one of " + setting.choices());
                }
                return trimmed;
            }
            case STRING_LIST -> {
                try {
                    List<String> names = objectMapper.readValue(trimmed, new TypeReference<List<String>>() { });
                    if (names.contains(null)) {
                        throw new CommandRejectedException("Setting '" + setting.key() + "' must not contain null entries");
                    }
                    return objectMapper.writeValueAsString(names);
                } catch (JsonProcessingException e) {
                    throw new CommandRejectedException("Setting '" + setting.key() + "' must be a JSON array of strings");
                }
            }
            case TEXT -> {
                if (trimmed.isEmpty()) {
                    throw new CommandRejectedException("Setting '" + setting.key() + "' must not be blank");
                }
                return trimmed;
            }
            default -> throw new IllegalStateException("Unhandled value kind " + setting.kind());
        }
    }

    public Map<String, String> all() {
        return store.getAllSettings();
    }

    public BreakConfig breakConfig(BreakKind kind) {
        return switch (kind) {
            case MICRO -> new BreakConfig(
                store.getIntSetting(SettingKey.MICRO_BREAK_INTERVAL), store.getIntSetting(SettingKey.MICRO_BREAK_DURATION));
            case MACRO -> new BreakConfig(
                store.getIntSetting(SettingKey.MACRO_BREAK_INTERVAL), store.getIntSetting(SettingKey.MACRO_BREAK_DURATION));
            case HYDRATION -> new BreakConfig(
                store.getIntSetting(SettingKey.HYDRATION_INTERVAL), store.getIntSetting(SettingKey.HYDRATION_DURATION));
        };
    }

    /** The break kind whose interval or duration this setting controls. */
    public static Optional<BreakKind> breakKindOf(SettingKey setting) {
        return switch (setting) {
            case MICRO_BREAK_INTERVAL, MICRO_BREAK_DURATION -> Optional.of(BreakKind.MICRO);
            case MACRO_BREAK_INTERVAL, MACRO_BREAK_DURATION -> Optional.of(BreakKind.MACRO);
            case HYDRATION_INTERVAL, HYDRATION_DURATION -> Optional.of(BreakKind.HYDRATION);
            default -> Optional.empty();
        };
    }

    public TimerMode timerMode() {
        String raw = store.getSetting(SettingKey.TIMER_MODE);
        return TimerMode.fromWire(raw).orElseGet(() -> {
            log.warn("Unknown timer_mode '{}', using wall-clock", raw);
            return TimerMode.WALL_CLOCK;
        });
    }

    public Duration idleThreshold() {
        return Duration.ofSeconds(store.getIntSetting(SettingKey.IDLE_THRESHOLD));
    }

    public boolean autoDetectFullscreen() {
        return store.getBooleanSetting(SettingKey.AUTO_DETECT_FULLSCREEN);
    }

    public int waterGoal() {
        return store.getIntSetting(SettingKey.WATER_GOAL);
    }

    public List<String> blocklist() {
        String raw = store.getSetting(SettingKey.BLOCKLIST_PROCESSES);
        try {
            return objectMapper.readValue(raw, new TypeReference<List<String>>() { });
        } catch (JsonProcessingException e) {
            log.warn("Stored blocklist is not a JSON array, ignoring it: {}", e.getMessage());
            return List.of();
        }
    }
}
