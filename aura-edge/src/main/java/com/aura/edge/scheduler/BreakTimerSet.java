package com.aura.edge.scheduler;

import com.aura.edge.domain.BreakPhase;
import com.aura.edge.domain.EngineCheckpoint.TimerCheckpoint;
import com.aura.edge.domain.TimerMode;
import com.aura.shared.ActivityState;
import com.aura.shared.BreakKind;
import com.aura.shared.protocol.Payloads;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The three break countdowns and the single pending-break slot they share.
 * <p>
 * At most one break is pending at a time. While one is pending no timer advances, so
 * the user is never shown a second reminder on top of an unanswered one. Not thread-safe:
 * owned by the engine tick thread.
 */
@Slf4j
public class BreakTimerSet {

    /**
     * What a complete, snooze or skip released.
     *
     * @param logId            break log row to update, {@code null} if the fire was never logged
     * @param trainingSampleId training sample to label, {@code null} if none was recorded
     */
    public record Resolution(BreakKind kind, Long logId, Long trainingSampleId) {
    }

    private final Map<BreakKind, BreakTimer> timers = new EnumMap<>(BreakKind.class);

    /** The break awaiting the user's answer, if any. */
    @Getter
    private BreakKind pending;

    /** Local date on which the daily water goal was met; hydration stays quiet for that day. */
    @Getter
    private LocalDate hydrationSilencedOn;

    public BreakTimerSet(Map<BreakKind, BreakConfig> configs) {
        for (BreakKind kind : BreakKind.values()) {
            timers.put(kind, new BreakTimer(kind, configs.getOrDefault(kind, BreakConfig.defaults(kind))));
        }
    }

    public BreakTimer timer(BreakKind kind) {
        return timers.get(kind);
    }

    public Collection<BreakTimer> timers() {
        return Collections.unmodifiableCollection(timers.values());
    }

    // === Tick ===

    /**
     * Advances the timers by {@code deltaMillis} if every gate is open and fires the
     * highest-priority due timer.
     *
     * @return the break that became pending during this tick
     */
    public Optional<BreakKind> tick(long deltaMillis, boolean sessionActive, boolean remindersPaused,
                                    ActivityState activity, TimerMode mode, LocalDate today) {
        if (pending != null || !sessionActive || remindersPaused) {
            return Optional.empty();
        }
        if (mode == TimerMode.ACTIVE && activity != ActivityState.ACTIVE) {
            return Optional.empty();
        }

        for (BreakTimer timer : timers.values()) {
            if (timer.kind() == BreakKind.HYDRATION && isHydrationSilenced(today)) {
                timer.reset();
                continue;
            }
            timer.advance(deltaMillis);
        }

        for (BreakKind kind : BreakKind.values()) {
            BreakTimer timer = timers.get(kind);
            if (kind == BreakKind.HYDRATION && isHydrationSilenced(today)) {
                continue;
            }
            if (timer.isDue()) {
                timer.fire();
                pending = kind;
                log.info("{} break due after {}s", kind.wireName(), timer.elapsedSeconds());
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public void attachLog(BreakKind kind, Long logId, Long trainingSampleId) {
        BreakTimer timer = timers.get(kind);
        timer.attachLog(logId);
        timer.attachTrainingSample(trainingSampleId);
    }

    // === Resolution ===

    public Optional<Resolution> complete() {
        if (pending == null) {
            log.warn("complete_break ignored, no break is pending");
            return Optional.empty();
        }
        BreakTimer timer = timers.get(pending);
        Resolution resolution = new Resolution(pending, timer.logId(), timer.trainingSampleId());
        timer.resolve();
        if (pending == BreakKind.MACRO) {
            timers.get(BreakKind.MICRO).reset();
        }
        pending = null;
        return Optional.of(resolution);
    }

    public Optional<Resolution> snooze(int minutes) {
        if (pending == null) {
            log.warn("snooze_break ignored, no break is pending");
            return Optional.empty();
        }
        BreakTimer timer = timers.get(pending);
        Resolution resolution = new Resolution(pending, timer.logId(), timer.trainingSampleId());
        timer.snooze(minutes);
        pending = null;
        return Optional.of(resolution);
    }

    public Optional<Resolution> skip() {
        if (pending == null) {
            log.warn("skip_break ignored, no break is pending");
            return Optional.empty();
        }
        BreakTimer timer = timers.get(pending);
        Resolution resolution = new Resolution(pending, timer.logId(), timer.trainingSampleId());
        timer.resolve();
        pending = null;
        return Optional.of(resolution);
    }

    // === Resets and reloads ===

    /** Zeroes every elapsed counter. A pending break stays pending. */
    public void resetAll() {
        timers.values().forEach(BreakTimer::reset);
    }

    /** Zeroes every counter and drops the pending break along with any attached log rows. */
    public void clear() {
        for (BreakTimer timer : timers.values()) {
            timer.restore(0, BreakPhase.IDLE, null, null);
        }
        pending = null;
    }

    /**
     * Applies a new interval and duration and restarts the countdown in one step. If this
     * break is pending it stays pending; the new duration applies from the next occurrence.
     */
    public void reloadAndReset(BreakKind kind, BreakConfig config) {
        timers.get(kind).reload(config);
        log.info("{} timer reloaded: interval={}s duration={}s", kind.wireName(),
            config.intervalSeconds(), config.durationSeconds());
    }

    // === Hydration silence ===

    public void silenceHydration(LocalDate day) {
        hydrationSilencedOn = day;
        if (day != null) {
            timers.get(BreakKind.HYDRATION).reset();
        }
    }

    public boolean isHydrationSilenced(LocalDate today) {
        return today != null && today.equals(hydrationSilencedOn);
    }

    // === Status ===

    /**
     * The break that will be shown next: the pending one, otherwise the running timer
     * with the least time left.
     */
    public Payloads.NextBreak nextBreak(TimerMode mode, LocalDate today) {
        BreakTimer next;
        if (pending != null) {
            next = timers.get(pending);
        } else {
            next = null;
            for (BreakKind kind : BreakKind.values()) {
                if (kind == BreakKind.HYDRATION && isHydrationSilenced(today)) {
                    continue;
                }
                BreakTimer candidate = timers.get(kind);
                if (next == null || candidate.remainingSeconds() < next.remainingSeconds()) {
                    next = candidate;
                }
            }
        }
        if (next == null) {
            return null;
        }
        long remaining = next.kind() == pending ? 0 : next.remainingSeconds();
        return new Payloads.NextBreak(next.kind(), remaining, next.durationSeconds(),
            next.kind().themeColor(), mode.wireName());
    }

    public Map<String, Payloads.TimerStatus> status(LocalDate today) {
        Map<String, Payloads.TimerStatus> status = new LinkedHashMap<>();
        for (BreakTimer timer : timers.values()) {
            status.put(timer.kind().wireName(), new Payloads.TimerStatus(
                timer.intervalSeconds(),
                timer.durationSeconds(),
                timer.elapsedSeconds(),
                timer.remainingSeconds(),
                timer.progress(),
                timer.kind().themeColor(),
                timer.phase().wireName(),
                timer.kind() == BreakKind.HYDRATION && isHydrationSilenced(today)
            ));
        }
        return status;
    }

    // === Checkpoint ===

    public Map<String, TimerCheckpoint> snapshot() {
        Map<String, TimerCheckpoint> snapshot = new LinkedHashMap<>();
        for (BreakTimer timer : timers.values()) {
            snapshot.put(timer.kind().wireName(), new TimerCheckpoint(
                timer.elapsedMillis(), timer.phase(), timer.logId(), timer.trainingSampleId()));
        }
        return snapshot;
    }

    public void restore(Map<String, TimerCheckpoint> snapshot, BreakKind pendingBreak) {
        for (BreakTimer timer : timers.values()) {
            TimerCheckpoint saved = snapshot == null ? null : snapshot.get(timer.kind().wireName());
            if (saved == null) {
                timer.restore(0, BreakPhase.IDLE, null, null);
            } else {
                BreakPhase phase = saved.phase() == BreakPhase.FIRED_PENDING && timer.kind() != pendingBreak
                    ? BreakPhase.IDLE
                    : saved.phase();
                timer.restore(saved.elapsedMillis(), phase, saved.logId(), saved.trainingSampleId());
            }
        }
        pending = pendingBreak;
        if (pending != null) {
            timers.get(pending).fire();
        }
    }
}
