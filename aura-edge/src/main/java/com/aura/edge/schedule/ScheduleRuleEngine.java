package com.aura.edge.schedule;

import com.aura.shared.ScheduleRule;
import com.aura.shared.Weekday;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches enabled schedule rules against the local wall clock.
 * <p>
 * Each rule fires at most once per calendar minute and is announced once, one minute
 * ahead. Rules due in the same minute are returned in ascending id order. The engine
 * performs the actions; this class only decides which ones are due.
 */
@Slf4j
public class ScheduleRuleEngine {

    static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public record Warning(ScheduleRule rule, int secondsRemaining) {
    }

    public record Evaluation(List<Warning> warnings, List<ScheduleRule> fired) {

        public boolean isEmpty() {
            return warnings.isEmpty() && fired.isEmpty();
        }
    }

    private List<ScheduleRule> rules = List.of();
    private final Map<Long, LocalDateTime> lastFired = new HashMap<>();
    private final Map<Long, LocalDateTime> lastWarned = new HashMap<>();

    /**
     * Replaces the working set. Disabled rules are dropped here, so callers may pass
     * every stored rule.
     */
    public void reload(List<ScheduleRule> stored) {
        rules = stored.stream()
            .filter(ScheduleRule::enabled)
            .sorted(Comparator.comparingLong(ScheduleRule::id))
            .toList();
        lastFired.keySet().retainAll(rules.stream().map(ScheduleRule::id).toList());
        lastWarned.keySet().retainAll(rules.stream().map(ScheduleRule::id).toList());
        log.debug("{} schedule rules active", rules.size());
    }

    public List<ScheduleRule> rules() {
        return rules;
    }

    public Evaluation evaluate(LocalDateTime now) {
        LocalDateTime minute = now.truncatedTo(ChronoUnit.MINUTES);
        LocalDateTime upcoming = minute.plusMinutes(1);
        int secondsToUpcoming = (int) ((Duration.between(now, upcoming).toMillis() + 999) / 1000);

        List<Warning> warnings = new ArrayList<>();
        List<ScheduleRule> fired = new ArrayList<>();
        for (ScheduleRule rule : rules) {
            if (matches(rule, upcoming) && !upcoming.equals(lastWarned.get(rule.id()))) {
                lastWarned.put(rule.id(), upcoming);
                warnings.add(new Warning(rule, secondsToUpcoming));
            }
            if (matches(rule, minute) && !minute.equals(lastFired.get(rule.id()))) {
                lastFired.put(rule.id(), minute);
                fired.add(rule);
            }
        }
        return new Evaluation(warnings, fired);
    }

    static boolean matches(ScheduleRule rule, LocalDateTime minute) {
        return rule.enabled()
            && rule.time().equals(HH_MM.format(minute))
            && rule.appliesOn(Weekday.of(minute.getDayOfWeek()));
    }
}
