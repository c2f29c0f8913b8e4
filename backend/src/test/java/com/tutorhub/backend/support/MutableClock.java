package com.tutorhub.backend.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * UTC clock that tests move forward explicitly.
 */
public class MutableClock extends Clock {

    private Instant instant;

    public MutableClock(OffsetDateTime start) {
        this.instant = start.toInstant();
    }

    public void advance(Duration duration) {
        instant = instant.plus(duration);
    }

    public OffsetDateTime now() {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return Clock.fixed(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
