package com.aura.edge.scheduler;

import com.aura.shared.SessionState;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * Work session lifecycle plus the orthogonal reminder pause.
 * <pre>
 *   start:  idle, paused -&gt; active
 *   pause:  active       -&gt; paused
 *   resume: paused       -&gt; active
 *   end:    active, paused -&gt; idle
 * </pre>
 * Every operation returns whether anything changed; invalid transitions are logged
 * and leave the state as it was.
 */
@Slf4j
public class SessionStateMachine {

    private SessionState state = SessionState.IDLE;
    private boolean remindersPaused;
    private Instant pauseUntil;

    public SessionState state() {
        return state;
    }

    public boolean isActive() {
        return state == SessionState.ACTIVE;
    }

    public boolean start() {
        if (state == SessionState.ACTIVE) {
            log.warn("start_session ignored, session already active");
            return false;
        }
        state = SessionState.ACTIVE;
        return true;
    }

    public boolean pause() {
        if (state != SessionState.ACTIVE) {
            log.warn("pause_session ignored in state {}", state);
            return false;
        }
        state = SessionState.PAUSED;
        return true;
    }

    public boolean resume() {
        if (state != SessionState.PAUSED) {
            log.warn("resume_session ignored in state {}", state);
            return false;
        }
        state = SessionState.ACTIVE;
        return true;
    }

    public boolean end() {
        if (state == SessionState.IDLE) {
            log.warn("end_session ignored, no session running");
            return false;
        }
        state = SessionState.IDLE;
        return true;
    }

    // reminder pause

    /**
     * @param until end of the pause, or {@code null} to pause until resumed explicitly
     */
    public void pauseReminders(Instant until) {
        remindersPaused = true;
        pauseUntil = until;
    }

    public boolean resumeReminders() {
        if (!remindersPaused) {
            return false;
        }
        remindersPaused = false;
        pauseUntil = null;
        return true;
    }

    /**
     * Clears a timed reminder pause whose end has passed.
     *
     * @return {@code true} if the pause expired on this call
     */
    public boolean expireReminderPause(Instant now) {
        if (remindersPaused && pauseUntil != null && !now.isBefore(pauseUntil)) {
            remindersPaused = false;
            pauseUntil = null;
            log.info("Reminder pause expired");
            return true;
        }
        return false;
    }

    public boolean remindersPaused(Instant now) {
        return remindersPaused && (pauseUntil == null || now.isBefore(pauseUntil));
    }

    public boolean remindersPaused() {
        return remindersPaused;
    }

    public Instant pauseUntil() {
        return pauseUntil;
    }

    public void restore(SessionState state, boolean remindersPaused, Instant pauseUntil) {
        this.state = state == null ? SessionState.IDLE : state;
        this.remindersPaused = remindersPaused;
        this.pauseUntil = remindersPaused ? pauseUntil : null;
    }
}
