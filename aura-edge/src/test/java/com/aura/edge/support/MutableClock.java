package com.aura.edge.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A clock tests move by hand. Always UTC so local dates and weekdays are predictable.
 */
public class MutableClock extends Clock {

    /** Monday 2024-01-15 09:00 UTC. */
    public static final LocalDateTime MONDAY_MORNING = LocalDateTime.of(2024, 1, 15, 9, 0);

    private Instant now;

    public MutableClock(LocalDateTime start) {
        this.now = start.toInstant(ZoneOffset.UTC);
    }

    public MutableClock() {
        this(MONDAY_MORNING);
    }

    public void advance(Duration duration) {
        now = now.plus(duration);
    }

    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    public void set(LocalDateTime time) {
        now = time.toInstant(ZoneOffset.UTC);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        throw new UnsupportedOperationException("MutableClock is fixed to UTC");
    }

    @Override
    public Instant instant() {
        return now;
    }
}
