package com.aura.edge.scheduler;

import com.aura.edge.domain.BreakPhase;
import com.aura.shared.BreakKind;

/**
 * Countdown for a single break kind. Elapsed time is kept in milliseconds so that
 * sub-second ticks do not drift; everything reported outward is whole seconds.
 */
public class BreakTimer {

    private final BreakKind kind;
    private int intervalSeconds;
    private int durationSeconds;
    private long elapsedMillis;
    private BreakPhase phase = BreakPhase.IDLE;
    private Long logId;
    private Long trainingSampleId;

    BreakTimer(BreakKind kind, BreakConfig config) {
        this.kind = kind;
        this.intervalSeconds = config.intervalSeconds();
        this.durationSeconds = config.durationSeconds();
    }

    void advance(long deltaMillis) {
        if (deltaMillis > 0) {
            elapsedMillis += deltaMillis;
        }
        if (phase == BreakPhase.RESOLVED) {
            phase = BreakPhase.IDLE;
        }
    }

    boolean isDue() {
        return elapsedMillis >= intervalSeconds * 1000L;
    }

    void reset() {
        elapsedMillis = 0;
    }

    void reload(BreakConfig config) {
        intervalSeconds = config.intervalSeconds();
        durationSeconds = config.durationSeconds();
        elapsedMillis = 0;
    }

    void fire() {
        phase = BreakPhase.FIRED_PENDING;
    }

    /** Completed or skipped: the log row is closed and the countdown starts over. */
    void resolve() {
        elapsedMillis = 0;
        phase = BreakPhase.RESOLVED;
        logId = null;
        trainingSampleId = null;
    }

    /** Snoozed: fire again {@code minutes} from now, reusing the same log row. */
    void snooze(int minutes) {
        elapsedMillis = Math.max(0, intervalSeconds * 1000L - minutes * 60_000L);
        phase = BreakPhase.RESOLVED;
        trainingSampleId = null;
    }

    void restore(long elapsedMillis, BreakPhase phase, Long logId, Long trainingSampleId) {
        this.elapsedMillis = Math.max(0, elapsedMillis);
        this.phase = phase == null ? BreakPhase.IDLE : phase;
        this.logId = logId;
        this.trainingSampleId = trainingSampleId;
    }

    public BreakKind kind() {
        return kind;
    }

    public int intervalSeconds() {
        return intervalSeconds;
    }

    public int durationSeconds() {
        return durationSeconds;
    }

    public long elapsedMillis() {
        return elapsedMillis;
    }

    public long elapsedSeconds() {
        return elapsedMillis / 1000;
    }

    public long remainingSeconds() {
        return Math.max(0, intervalSeconds - elapsedSeconds());
    }

    public double progress() {
        return Math.min(1.0, elapsedMillis / (intervalSeconds * 1000.0));
    }

    public BreakPhase phase() {
        return phase;
    }

    public Long logId() {
        return logId;
    }

    void attachLog(Long logId) {
        this.logId = logId;
    }

    public Long trainingSampleId() {
        return trainingSampleId;
    }

    void attachTrainingSample(Long trainingSampleId) {
        this.trainingSampleId = trainingSampleId;
    }
}
