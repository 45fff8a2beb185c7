package org.pak.brefv.core;

import org.junit.jupiter.api.Test;
import org.pak.brefv.core.error.ClockUnavailableException;
import org.pak.brefv.core.error.CoreException;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SystemTimeSourceTest {

    @Test
    void nowTest() {
        var before = Instant.now();
        var now = SystemTimeSource.INSTANCE.now();
        var after = Instant.now();

        assertThat(now).isBetween(before, after);
    }

    @Test
    void fixedClockTest() {
        var instant = Instant.ofEpochSecond(1234567890L, 123456789);

        assertThat(new SystemTimeSource(Clock.fixed(instant, ZoneOffset.UTC)).now()).isEqualTo(instant);
    }

    @Test
    void clockFailureTest() {
        var timeSource = new SystemTimeSource(new BrokenClock());

        var exception = assertThrows(ClockUnavailableException.class, timeSource::now);

        assertThat(exception).isNotInstanceOf(CoreException.class);
        assertThat(exception).hasCauseInstanceOf(DateTimeException.class);
    }

    static class BrokenClock extends Clock {
        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            throw new DateTimeException("clock is gone");
        }
    }
}
