package com.aura.shared.protocol;

import com.aura.shared.ActivitySnapshot;
import com.aura.shared.ActivityState;
import com.aura.shared.BreakKind;
import com.aura.shared.ScheduleAction;
import com.aura.shared.ScheduleRule;
import com.aura.shared.SessionState;

import java.util.List;
import java.util.Map;

/**
 * Event payloads. Field names are written in snake_case on the wire.
 */
public final class Payloads {

    private Payloads() {
    }

    public record Ready(String version, String dbPath) {
    }

    public record ErrorMessage(String message) {
    }

    public record StateChange(ActivityState state) {
    }

    public record SessionInfo(SessionState state) {
    }

    public record RemindersPaused(Integer minutes) {
    }

    public record NextBreak(
        BreakKind type,
        long remainingSeconds,
        int durationSeconds,
        String themeColor,
        String timerMode
    ) {
    }

    public record Metrics(ActivitySnapshot activity, NextBreak nextBreak) {
    }

    public record TimerStatus(
        int intervalSeconds,
        int durationSeconds,
        long elapsedSeconds,
        long remainingSeconds,
        double progress,
        String themeColor,
        String phase,
        boolean silenced
    ) {
    }

    /**
     * @param pauseUntil epoch seconds, {@code null} for an indefinite pause or none
     * @param breaks     keyed by break wire name
     */
    public record SchedulerStatus(
        SessionState sessionState,
        boolean paused,
        Long pauseUntil,
        String timerMode,
        BreakKind pendingBreak,
        Map<String, TimerStatus> breaks
    ) {
    }

    public record Hydration(Integer amountMl, int totalTodayMl, int goalMl, double progress) {

        public static Hydration of(Integer amountMl, int totalTodayMl, int goalMl) {
            double progress = goalMl <= 0 ? 1.0 : Math.min(1.0, (double) totalTodayMl / goalMl);
            return new Hydration(amountMl, totalTodayMl, goalMl, progress);
        }
    }

    public record Status(
        ActivitySnapshot metrics,
        SchedulerStatus scheduler,
        NextBreak nextBreak,
        Hydration hydration
    ) {
    }

    public record BreakDue(BreakKind breakType, int durationSeconds, String themeColor, Long recordId) {
    }

    public record BreakSnoozed(int minutes) {
    }

    public record SettingUpdated(String key, String value) {
    }

    public record RuleList(List<ScheduleRule> rules) {
    }

    public record RuleChange(long id, List<ScheduleRule> rules) {
    }

    public record ScheduleWarning(ScheduleAction action, String time, String title, int secondsRemaining) {
    }

    public record ScheduleActionExecuted(ScheduleAction action, String time, String title) {
    }

    public record DataExported(String path, int records) {
    }

    public record TrainingStats(int totalSamples, int labeledSamples, int completed, int dismissed) {
    }
}
