package com.aura.edge.config;

import java.util.List;
import java.util.Optional;

/**
 * Every user setting the engine understands, with its default value and value shape.
 * {@code update_setting} rejects keys that are not listed here.
 */
public enum SettingKey {
    WATER_GOAL("water_goal", "2000", ValueKind.POSITIVE_INT),
    MICRO_BREAK_INTERVAL("micro_break_interval", "1200", ValueKind.POSITIVE_INT),
    MICRO_BREAK_DURATION("micro_break_duration", "20", ValueKind.NON_NEGATIVE_INT),
    MACRO_BREAK_INTERVAL("macro_break_interval", "2700", ValueKind.POSITIVE_INT),
    MACRO_BREAK_DURATION("macro_break_duration", "180", ValueKind.NON_NEGATIVE_INT),
    HYDRATION_INTERVAL("hydration_interval", "1800", ValueKind.POSITIVE_INT),
    HYDRATION_DURATION("hydration_duration", "0", ValueKind.NON_NEGATIVE_INT),
    IDLE_THRESHOLD("idle_threshold", "180", ValueKind.POSITIVE_INT),
    TIMER_MODE("timer_mode", "wall-clock", ValueKind.CHOICE, "active", "wall-clock"),
    AUTO_DETECT_FULLSCREEN("auto_detect_fullscreen", "true", ValueKind.BOOLEAN),
    BLOCKLIST_PROCESSES("blocklist_processes",
        "[\"league_of_legends.exe\",\"vlc.exe\",\"obs64.exe\",\"zoom.exe\",\"discord.exe\"]",
        ValueKind.STRING_LIST),
    SOUND_ENABLED("sound_enabled", "true", ValueKind.BOOLEAN),
    IMMERSIVE_MODE_ENABLED("immersive_mode_enabled", "false", ValueKind.BOOLEAN),
    AUTO_START("auto_start", "false", ValueKind.BOOLEAN),
    CLOSE_TO_TRAY("close_to_tray", "true", ValueKind.BOOLEAN),
    THEME("theme", "dark", ValueKind.TEXT),
    SCHEDULE_MODE("schedule_mode", "same_every_day", ValueKind.CHOICE,
        "same_every_day", "weekday_weekend", "custom");

    public enum ValueKind {
        POSITIVE_INT,
        NON_NEGATIVE_INT,
        BOOLEAN,
        CHOICE,
        STRING_LIST,
        TEXT
    }

    private final String key;
    private final String defaultValue;
    private final ValueKind kind;
    private final List<String> choices;

    SettingKey(String key, String defaultValue, ValueKind kind, String... choices) {
        this.key = key;
        this.defaultValue = defaultValue;
        this.kind = kind;
        this.choices = List.of(choices);
    }

    public String key() {
        return key;
    }

    public String defaultValue() {
        return defaultValue;
    }

    public ValueKind kind() {
        return kind;
    }

    public List<String> choices() {
        return choices;
    }

    public static Optional<SettingKey> fromKey(String key) {
        for (SettingKey setting : values()) {
            if (setting.key.equals(key)) {
                return Optional.of(setting);
            }
        }
        return Optional.empty();
    }
}
