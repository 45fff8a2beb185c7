package org.pak.brefv.core;

import org.pak.brefv.core.error.ClockUnavailableException;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;

/**
 * {@link TimeSource} backed by a {@link Clock}, the system UTC clock unless told otherwise.
 */
public class SystemTimeSource implements TimeSource {
    public static final SystemTimeSource INSTANCE = new SystemTimeSource(Clock.systemUTC());

    private final Clock clock;

    public SystemTimeSource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Instant now() {
        try {
            return clock.instant();
        } catch (DateTimeException e) {
            throw new ClockUnavailableException(e);
        }
    }
}
