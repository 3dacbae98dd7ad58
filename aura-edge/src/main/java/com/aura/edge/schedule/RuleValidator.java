package com.aura.edge.schedule;

import com.aura.edge.gateway.CommandRejectedException;
import com.aura.shared.ScheduleAction;
import com.aura.shared.Weekday;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks user-supplied rule fields before anything is written.
 */
@Slf4j
public final class RuleValidator {

    private static final Pattern TIME = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");

    public record ValidRule(String time, ScheduleAction action, Set<Weekday> days, String title) {
    }

    private RuleValidator() {
    }

    public static ValidRule validate(String time, String action, Collection<String> days, String title) {
        if (time == null || !TIME.matcher(time.trim()).matches()) {
            throw new CommandRejectedException("Invalid rule time '" + time + "', expected HH:MM (24h)");
        }
        ScheduleAction parsedAction = ScheduleAction.fromWire(action)
            .orElseThrow(() -> new CommandRejectedException("Unknown rule action '" + action + "'"));

        Set<Weekday> parsedDays = EnumSet.noneOf(Weekday.class);
        if (days != null) {
            for (String day : days) {
                Weekday.fromWire(day).ifPresentOrElse(parsedDays::add,
                    () -> log.warn("Ignoring unknown rule day '{}'", day));
            }
        }
        if (parsedDays.isEmpty()) {
            throw new CommandRejectedException("A rule needs at least one valid day (mon..sun)");
        }
        return new ValidRule(time.trim(), parsedAction, parsedDays, title == null ? "" : title.trim());
    }
}
