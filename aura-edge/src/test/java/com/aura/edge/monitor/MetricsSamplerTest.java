package com.aura.edge.monitor;

import com.aura.edge.support.MutableClock;
import com.aura.shared.ActivitySnapshot;
import com.aura.shared.ActivityState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

/**
 * Tests for {@link MetricsSampler}.
 */
class MetricsSamplerTest {

    private MutableClock clock;
    private ForegroundWindow foreground;
    private MetricsSampler sampler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        foreground = ForegroundWindow.UNKNOWN;
        sampler = new MetricsSampler(() -> foreground, Duration.ofSeconds(60), Duration.ofSeconds(1), clock);
    }

    private Instant at(long millis) {
        return clock.instant().plusMillis(millis);
    }

    @Test
    @DisplayName("velocity and key rate are averaged over the window")
    void sample_recentInput_reportsWindowAverages() {
        sampler.submit(InputEvent.mouseMove(at(0), 0, 0));
        sampler.submit(InputEvent.mouseMove(at(100), 60, 80));
        for (int i = 0; i < 30; i++) {
            sampler.submit(InputEvent.keyPress(at(200)));
        }

        ActivitySnapshot snapshot = sampler.sample(at(500));

        assertEquals(100.0 / 60.0, snapshot.mouseVelocity(), 1e-9);
        assertEquals(30, snapshot.keysPerMinute());
        assertEquals(ActivityState.ACTIVE, snapshot.state());
    }

    @Test
    @DisplayName("metrics read exactly zero once input stops for longer than the idle-zero threshold")
    void sample_afterSilence_forcesZero() {
        sampler.submit(InputEvent.mouseMove(at(0), 0, 0));
        sampler.submit(InputEvent.mouseMove(at(0), 300, 400));
        sampler.submit(InputEvent.keyPress(at(0)));

        ActivitySnapshot snapshot = sampler.sample(at(1_500));

        assertEquals(0.0, snapshot.mouseVelocity());
        assertEquals(0, snapshot.keysPerMinute());
        assertEquals(1, snapshot.idleSeconds());
    }

    @Test
    @DisplayName("mouse jitter of 5px or less is not activity")
    void sample_jitter_isIgnored() {
        sampler.submit(InputEvent.mouseMove(at(10_000), 0, 0));
        sampler.submit(InputEvent.mouseMove(at(10_000), 3, 4));

        ActivitySnapshot snapshot = sampler.sample(at(10_000));

        assertEquals(0.0, snapshot.mouseVelocity());
        assertEquals(10, snapshot.idleSeconds());
    }

    @Test
    @DisplayName("jitter still moves the reference position for the next move")
    void sample_jitter_updatesLastPosition() {
        sampler.submit(InputEvent.mouseMove(at(0), 0, 0));
        sampler.submit(InputEvent.mouseMove(at(0), 4, 0));
        sampler.submit(InputEvent.mouseMove(at(0), 10, 0));

        ActivitySnapshot snapshot = sampler.sample(at(100));

        assertEquals(6.0 / 60.0, snapshot.mouseVelocity(), 1e-9);
    }

    @Test
    @DisplayName("events older than the window are pruned")
    void sample_oldKeys_arePruned() {
        sampler.submit(InputEvent.keyPress(at(0)));
        sampler.submit(InputEvent.keyPress(at(61_000)));

        ActivitySnapshot snapshot = sampler.sample(at(61_000));

        assertEquals(1, snapshot.keysPerMinute());
    }

    @Test
    @DisplayName("clicks and scrolls keep the user active without adding distance")
    void sample_clicksAndScrolls_countAsInput() {
        sampler.submit(InputEvent.click(at(200_000)));
        sampler.submit(InputEvent.scroll(at(200_000)));

        ActivitySnapshot snapshot = sampler.sample(at(200_500));

        assertEquals(ActivityState.ACTIVE, snapshot.state());
        assertEquals(0, snapshot.idleSeconds());
        assertEquals(0.0, snapshot.mouseVelocity());
    }

    @Test
    @DisplayName("state becomes idle once silence reaches the idle threshold")
    void sample_longSilence_isIdle() {
        assertEquals(ActivityState.ACTIVE, sampler.sample(at(179_000)).state());
        assertEquals(ActivityState.IDLE, sampler.sample(at(180_000)).state());
    }

    @Test
    @DisplayName("a lowered idle threshold applies on the next sample")
    void setIdleThreshold_appliesImmediately() {
        sampler.setIdleThreshold(Duration.ofSeconds(30));

        assertEquals(ActivityState.IDLE, sampler.sample(at(30_000)).state());
    }

    @Test
    @DisplayName("fullscreen is immersive only while auto-detect is on")
    void sample_fullscreen_respectsAutoDetect() {
        foreground = new ForegroundWindow("game.exe", true);

        assertEquals(ActivityState.IMMERSIVE, sampler.sample(at(0)).state());

        sampler.setAutoDetectFullscreen(false);
        assertEquals(ActivityState.ACTIVE, sampler.sample(at(1_000)).state());
    }

    @Test
    @DisplayName("block-listed processes are immersive regardless of case")
    void sample_blocklistedProcess_isImmersive() {
        sampler.setBlocklist(List.of("vlc.exe"));
        foreground = new ForegroundWindow("VLC.exe", false);

        ActivitySnapshot snapshot = sampler.sample(at(0));

        assertEquals(ActivityState.IMMERSIVE, snapshot.state());
        assertEquals("VLC.exe", snapshot.foregroundApp());
    }

    @Test
    @DisplayName("immersive wins over idle")
    void sample_immersiveAndIdle_isImmersive() {
        foreground = new ForegroundWindow("player", true);

        assertEquals(ActivityState.IMMERSIVE, sampler.sample(at(600_000)).state());
    }

    @Test
    @DisplayName("a failing foreground probe degrades to an unknown window")
    void sample_probeFailure_degrades() {
        MetricsSampler failing = new MetricsSampler(() -> {
            throw new IllegalStateException("no display");
        }, Duration.ofSeconds(60), Duration.ofSeconds(1), clock);

        ActivitySnapshot snapshot = failing.sample(at(0));

        assertEquals("", snapshot.foregroundApp());
        assertFalse(snapshot.fullscreen());
        assertEquals(ActivityState.ACTIVE, snapshot.state());
    }

    @Test
    @DisplayName("active seconds only accumulate while active")
    void sample_activeSeconds_accumulateWhileActive() {
        sampler.sample(at(0));
        assertEquals(5, sampler.sample(at(5_000)).activeSeconds());

        foreground = new ForegroundWindow("movie", true);
        sampler.sample(at(6_000));
        ActivitySnapshot snapshot = sampler.sample(at(20_000));

        assertEquals(6, snapshot.activeSeconds());
    }
}
