package com.aura.edge.schedule;

import com.aura.edge.gateway.CommandRejectedException;
import com.aura.shared.ScheduleAction;
import com.aura.shared.Weekday;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link RuleValidator}.
 */
class RuleValidatorTest {

    @Test
    @DisplayName("a well-formed rule is accepted and normalized")
    void validate_validRule_isAccepted() {
        RuleValidator.ValidRule rule = RuleValidator.validate("08:30", "start_session",
            List.of("fri", "MON", "wed"), " Morning ");

        assertEquals("08:30", rule.time());
        assertEquals(ScheduleAction.START_SESSION, rule.action());
        assertEquals(EnumSet.of(Weekday.MON, Weekday.WED, Weekday.FRI), rule.days());
        assertEquals("Morning", rule.title());
    }

    @ParameterizedTest
    @ValueSource(strings = {"24:00", "7:00", "12:60", "noon", ""})
    @DisplayName("times outside HH:MM 24h are rejected")
    void validate_badTime_isRejected(String time) {
        assertThrows(CommandRejectedException.class,
            () -> RuleValidator.validate(time, "pause", List.of("mon"), ""));
    }

    @Test
    @DisplayName("unknown actions are rejected")
    void validate_unknownAction_isRejected() {
        assertThrows(CommandRejectedException.class,
            () -> RuleValidator.validate("12:00", "reboot", List.of("mon"), ""));
    }

    @Test
    @DisplayName("a rule needs at least one valid day")
    void validate_noValidDay_isRejected() {
        assertThrows(CommandRejectedException.class,
            () -> RuleValidator.validate("12:00", "pause", List.of(), ""));
        assertThrows(CommandRejectedException.class,
            () -> RuleValidator.validate("12:00", "pause", List.of("someday"), ""));
        assertThrows(CommandRejectedException.class,
            () -> RuleValidator.validate("12:00", "pause", null, ""));
    }
}
