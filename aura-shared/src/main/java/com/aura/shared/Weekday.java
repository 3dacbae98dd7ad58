package com.aura.shared;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Optional;

/**
 * Day abbreviations used by schedule rules ({@code "mon"} .. {@code "sun"}).
 */
public enum Weekday {
    MON, TUE, WED, THU, FRI, SAT, SUN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public DayOfWeek toDayOfWeek() {
        return DayOfWeek.of(ordinal() + 1);
    }

    public static Weekday of(DayOfWeek day) {
        return values()[day.getValue() - 1];
    }

    public static Optional<Weekday> fromWire(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (Weekday day : values()) {
            if (day.wireName().equalsIgnoreCase(name.trim())) {
                return Optional.of(day);
            }
        }
        return Optional.empty();
    }
}
