package com.aura.shared;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * User-authored time-of-day automation entry.
 *
 * @param time      local wall-clock minute, {@code HH:MM} in 24h format
 * @param createdAt epoch seconds
 */
public record ScheduleRule(
    long id,
    String title,
    String time,
    ScheduleAction action,
    Set<Weekday> days,
    boolean enabled,
    long createdAt
) {
    public ScheduleRule {
        title = title == null ? "" : title;
        days = Collections.unmodifiableSet(days.isEmpty() ? EnumSet.noneOf(Weekday.class) : EnumSet.copyOf(days));
    }

    public String displayTitle() {
        return title.isBlank() ? action.label() + " at " + time : title;
    }

    public boolean appliesOn(Weekday day) {
        return days.contains(day);
    }
}
