package com.aura.edge.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link AppCategory}.
 */
class AppCategoryTest {

    @ParameterizedTest
    @CsvSource({
        "Code.exe, CODE",
        "  firefox  , WEB",
        "VLC.EXE, VIDEO",
        "cs2.exe, GAME",
        "notion.exe, PRODUCTIVITY",
        "slack, COMMUNICATION",
        "calc.exe, OTHER"
    })
    @DisplayName("process names are matched case-insensitively")
    void categorize_knownProcesses(String process, AppCategory expected) {
        assertEquals(expected, AppCategory.categorize(process));
    }

    @Test
    @DisplayName("missing process names are Other")
    void categorize_blank_isOther() {
        assertEquals(AppCategory.OTHER, AppCategory.categorize(null));
        assertEquals(AppCategory.OTHER, AppCategory.categorize(""));
    }

    @Test
    @DisplayName("labels round-trip and unknown labels are Other")
    void fromLabel_matchesLabel() {
        assertEquals(AppCategory.COMMUNICATION, AppCategory.fromLabel("communication"));
        assertEquals(AppCategory.OTHER, AppCategory.fromLabel("Spreadsheets"));
    }
}
