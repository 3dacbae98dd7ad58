package com.aura.edge.scheduler;

import com.aura.shared.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SessionStateMachine}.
 */
class SessionStateMachineTest {

    private static final Instant NOW = Instant.parse("2024-01-15T09:00:00Z");

    private SessionStateMachine session;

    @BeforeEach
    void setUp() {
        session = new SessionStateMachine();
    }

    @Test
    @DisplayName("a new session machine starts idle")
    void initialState_isIdle() {
        assertEquals(SessionState.IDLE, session.state());
        assertFalse(session.isActive());
    }

    @Test
    @DisplayName("start, pause, resume and end follow the lifecycle")
    void lifecycle_validTransitions() {
        assertTrue(session.start());
        assertEquals(SessionState.ACTIVE, session.state());

        assertTrue(session.pause());
        assertEquals(SessionState.PAUSED, session.state());

        assertTrue(session.resume());
        assertEquals(SessionState.ACTIVE, session.state());

        assertTrue(session.end());
        assertEquals(SessionState.IDLE, session.state());
    }

    @Test
    @DisplayName("a paused session can be started again or ended directly")
    void paused_canStartOrEnd() {
        session.start();
        session.pause();
        assertTrue(session.start());
        assertEquals(SessionState.ACTIVE, session.state());

        session.pause();
        assertTrue(session.end());
        assertEquals(SessionState.IDLE, session.state());
    }

    @Test
    @DisplayName("invalid transitions change nothing")
    void invalidTransitions_areNoOps() {
        assertFalse(session.pause());
        assertFalse(session.resume());
        assertFalse(session.end());
        assertEquals(SessionState.IDLE, session.state());

        session.start();
        assertFalse(session.start());
        assertFalse(session.resume());
        assertEquals(SessionState.ACTIVE, session.state());
    }

    @Test
    @DisplayName("a timed reminder pause expires by itself")
    void pauseReminders_timed_expires() {
        session.start();
        session.pauseReminders(NOW.plusSeconds(600));

        assertTrue(session.remindersPaused(NOW));
        assertTrue(session.isActive());
        assertFalse(session.expireReminderPause(NOW.plusSeconds(599)));

        assertTrue(session.expireReminderPause(NOW.plusSeconds(600)));
        assertFalse(session.remindersPaused(NOW.plusSeconds(600)));
        assertNull(session.pauseUntil());
    }

    @Test
    @DisplayName("an indefinite reminder pause lasts until resumed")
    void pauseReminders_indefinite_needsResume() {
        session.pauseReminders(null);

        assertFalse(session.expireReminderPause(NOW.plusSeconds(86_400)));
        assertTrue(session.remindersPaused(NOW.plusSeconds(86_400)));

        assertTrue(session.resumeReminders());
        assertFalse(session.remindersPaused(NOW));
        assertFalse(session.resumeReminders());
    }

    @Test
    @DisplayName("restore puts back session state and pause")
    void restore_appliesSavedState() {
        session.restore(SessionState.PAUSED, true, NOW);

        assertEquals(SessionState.PAUSED, session.state());
        assertTrue(session.remindersPaused());
        assertEquals(NOW, session.pauseUntil());
    }
}
