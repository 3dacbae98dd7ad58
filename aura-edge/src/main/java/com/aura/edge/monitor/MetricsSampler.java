package com.aura.edge.monitor;

import com.aura.shared.ActivitySnapshot;
import com.aura.shared.ActivityState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Locale;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

/**
 * Turns raw input events into a rolling-window {@link ActivitySnapshot}.
 * <p>
 * {@link #submit(InputEvent)} may be called from any thread (typically the OS hook
 * thread). Everything else runs on the engine tick thread: the queue is drained at the
 * start of every {@link #sample(Instant)} call.
 */
@Slf4j
public class MetricsSampler {

    /** Mouse moves of this many pixels or fewer are sensor jitter, not activity. */
    static final double JITTER_PIXELS = 5.0;

    private record Movement(Instant at, double distance) {
    }

    private final Queue<InputEvent> inbox = new ConcurrentLinkedQueue<>();
    private final ForegroundWindowProbe probe;
    private final Duration window;
    private final Duration idleZeroThreshold;

    private final Deque<Movement> movements = new ArrayDeque<>();
    private final Deque<Instant> keyPresses = new ArrayDeque<>();
    private boolean hasPosition;
    private int lastX;
    private int lastY;
    private Instant lastInput;
    private Instant lastSample;
    private long activeMillis;
    private ActivityState state = ActivityState.ACTIVE;

    private volatile Duration idleThreshold = Duration.ofSeconds(180);
    private volatile boolean autoDetectFullscreen = true;
    private volatile Set<String> blocklist = Set.of();

    public MetricsSampler(ForegroundWindowProbe probe, Duration window, Duration idleZeroThreshold, Clock clock) {
        this.probe = probe;
        this.window = window;
        this.idleZeroThreshold = idleZeroThreshold;
        this.lastInput = clock.instant();
    }

    public void submit(InputEvent event) {
        inbox.add(event);
    }

    public ActivityState state() {
        return state;
    }

    public void setIdleThreshold(Duration idleThreshold) {
        this.idleThreshold = idleThreshold;
    }

    public void setAutoDetectFullscreen(boolean autoDetectFullscreen) {
        this.autoDetectFullscreen = autoDetectFullscreen;
    }

    public void setBlocklist(Collection<String> processes) {
        this.blocklist = processes.stream()
            .map(name -> name.trim().toLowerCase(Locale.ROOT))
            .filter(name -> !name.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }

    public ActivitySnapshot sample(Instant now) {
        InputEvent event;
        while ((event = inbox.poll()) != null) {
            accept(event);
        }

        Instant cutoff = now.minus(window);
        while (!movements.isEmpty() && movements.peekFirst().at().isBefore(cutoff)) {
            movements.pollFirst();
        }
        while (!keyPresses.isEmpty() && keyPresses.peekFirst().isBefore(cutoff)) {
            keyPresses.pollFirst();
        }

        Duration silence = Duration.between(lastInput, now);
        double velocity = 0.0;
        int keysPerMinute = 0;
        if (silence.compareTo(idleZeroThreshold) <= 0) {
            double windowSeconds = window.toMillis() / 1000.0;
            double distance = movements.stream().mapToDouble(Movement::distance).sum();
            velocity = distance / windowSeconds;
            keysPerMinute = (int) (keyPresses.size() * 60 / windowSeconds);
        }

        ForegroundWindow foreground = probeForeground();
        boolean immersive = (autoDetectFullscreen && foreground.fullscreen())
            || blocklist.contains(foreground.processName().toLowerCase(Locale.ROOT));
        long idleSeconds = Math.max(0, silence.getSeconds());

        ActivityState next;
        if (immersive) {
            next = ActivityState.IMMERSIVE;
        } else if (idleSeconds >= idleThreshold.getSeconds()) {
            next = ActivityState.IDLE;
        } else {
            next = ActivityState.ACTIVE;
        }

        if (lastSample != null && state == ActivityState.ACTIVE && now.isAfter(lastSample)) {
            activeMillis += Duration.between(lastSample, now).toMillis();
        }
        lastSample = now;
        if (next != state) {
            log.debug("Activity state {} -> {}", state, next);
        }
        state = next;

        return new ActivitySnapshot(
            velocity,
            keysPerMinute,
            activeMillis / 1000,
            idleSeconds,
            next,
            foreground.processName(),
            foreground.fullscreen()
        );
    }

    private void accept(InputEvent event) {
        switch (event.kind()) {
            case MOUSE_MOVE -> {
                if (hasPosition) {
                    double distance = Math.hypot(event.x() - lastX, event.y() - lastY);
                    if (distance > JITTER_PIXELS) {
                        movements.addLast(new Movement(event.timestamp(), distance));
                        markInput(event.timestamp());
                    }
                }
                hasPosition = true;
                lastX = event.x();
                lastY = event.y();
            }
            case KEY_PRESS -> {
                keyPresses.addLast(event.timestamp());
                markInput(event.timestamp());
            }
            case CLICK, SCROLL -> markInput(event.timestamp());
        }
    }

    private void markInput(Instant at) {
        if (at.isAfter(lastInput)) {
            lastInput = at;
        }
    }

    private ForegroundWindow probeForeground() {
        try {
            ForegroundWindow current = probe.probe();
            return current == null ? ForegroundWindow.UNKNOWN : current;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Foreground probe interrupted");
            return ForegroundWindow.UNKNOWN;
        } catch (Exception e) {
            log.debug("Foreground probe failed: {}", e.getMessage());
            return ForegroundWindow.UNKNOWN;
        }
    }
}
