package com.aura.edge.gateway;

import com.aura.edge.domain.BreakPhase;
import com.aura.shared.ActivityState;
import com.aura.shared.SessionState;
import com.aura.shared.Weekday;
import com.aura.shared.protocol.Command;
import com.aura.shared.protocol.CommandType;
import com.aura.shared.protocol.Event;
import com.aura.shared.protocol.EventType;
import com.aura.shared.protocol.Payloads;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ProtocolMapper}.
 */
class ProtocolMapperTest {

    private final ObjectMapper mapper = ProtocolMapper.create();
    private Locale previous;

    @BeforeEach
    void setUp() {
        previous = Locale.getDefault();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(previous);
    }

    @Test
    @DisplayName("wire names do not depend on the default locale")
    void writeEvent_turkishLocale_keepsAsciiTags() {
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));

        String json = ProtocolMapper.writeEvent(mapper,
            Event.of(EventType.SESSION_STARTED, new Payloads.SessionInfo(SessionState.ACTIVE)));

        assertEquals("{\"type\":\"session_started\",\"data\":{\"state\":\"active\"}}", json);
        assertEquals("fri", Weekday.FRI.wireName());
        assertEquals("immersive", ActivityState.IMMERSIVE.wireName());
        assertEquals("idle", BreakPhase.IDLE.wireName());
        assertEquals("training_stats", EventType.TRAINING_STATS.wireName());
    }

    @Test
    @DisplayName("wire names still parse back under a Turkish locale")
    void readCommand_turkishLocale_parsesDays() {
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));

        Command command = ProtocolMapper.readCommand(mapper,
            "{\"cmd\":\"add_schedule_rule\",\"days\":[\"fri\",\"mon\"]}");

        assertEquals(CommandType.ADD_SCHEDULE_RULE, command.type().orElseThrow());
        assertEquals(Weekday.FRI, Weekday.fromWire(command.getDays().get(0)).orElseThrow());
    }

    @Test
    @DisplayName("lines that are not a JSON object with cmd are rejected")
    void readCommand_malformed_rejected() {
        assertThrows(CommandRejectedException.class, () -> ProtocolMapper.readCommand(mapper, "{\"cmd\":"));
        assertThrows(CommandRejectedException.class, () -> ProtocolMapper.readCommand(mapper, "42"));
        assertThrows(CommandRejectedException.class, () -> ProtocolMapper.readCommand(mapper, "{\"id\":1}"));
    }
}
