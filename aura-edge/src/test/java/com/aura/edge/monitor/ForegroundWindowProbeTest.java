package com.aura.edge.monitor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ForegroundWindowProbe} selection and {@link WindowsForegroundProbe}.
 */
class ForegroundWindowProbeTest {

    @ParameterizedTest
    @ValueSource(strings = {"Windows 11", "Windows 10", "Windows Server 2022"})
    @DisplayName("Windows hosts get the User32 probe")
    void forOs_windows_usesUser32(String osName) {
        assertInstanceOf(WindowsForegroundProbe.class, ForegroundWindowProbe.forOs(osName));
    }

    @Test
    @DisplayName("macOS gets the osascript probe and other systems report nothing")
    void forOs_otherSystems() throws Exception {
        assertInstanceOf(OsascriptForegroundProbe.class, ForegroundWindowProbe.forOs("Mac OS X"));
        assertEquals(ForegroundWindow.UNKNOWN, ForegroundWindowProbe.forOs("Linux").probe());
    }

    @Test
    @DisplayName("a window counts as fullscreen within the taskbar tolerance")
    void coversScreen_tolerances() {
        assertTrue(WindowsForegroundProbe.coversScreen(1920, 1080, 1920, 1080));
        assertTrue(WindowsForegroundProbe.coversScreen(1912, 1040, 1920, 1080));
        assertFalse(WindowsForegroundProbe.coversScreen(1600, 1080, 1920, 1080));
        assertFalse(WindowsForegroundProbe.coversScreen(1920, 900, 1920, 1080));
        assertFalse(WindowsForegroundProbe.coversScreen(0, 0, 0, 0));
    }

    @Test
    @DisplayName("the process name is the executable file name")
    void baseName_stripsDirectories() {
        assertEquals("vlc.exe", WindowsForegroundProbe.baseName("C:\\Program Files\\VideoLAN\\VLC\\vlc.exe"));
        assertEquals("obs64.exe", WindowsForegroundProbe.baseName("obs64.exe"));
    }
}
