package org.pak.brefv.core;

import com.google.protobuf.Timestamp;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimestampConverterTest {

    @Test
    void toTimestampTest() {
        var timestamp = TimestampConverter.toTimestamp(Instant.ofEpochSecond(1234567890L, 123456789));

        assertThat(timestamp.getSeconds()).isEqualTo(1234567890L);
        assertThat(timestamp.getNanos()).isEqualTo(123456789);
    }

    @Test
    void toInstantTest() {
        var timestamp = Timestamp.newBuilder().setSeconds(1234567890L).setNanos(123456789).build();

        assertThat(TimestampConverter.toInstant(timestamp)).isEqualTo(Instant.ofEpochSecond(1234567890L, 123456789));
    }

    @Test
    void beforeEpochTest() {
        var instant = Instant.ofEpochSecond(-2, 500_000_000);

        var timestamp = TimestampConverter.toTimestamp(instant);

        assertThat(timestamp.getSeconds()).isEqualTo(-2);
        assertThat(timestamp.getNanos()).isEqualTo(500_000_000);
        assertThat(TimestampConverter.toInstant(timestamp)).isEqualTo(instant);
    }

    @Test
    void invalidTimestampTest() {
        var timestamp = Timestamp.newBuilder().setSeconds(1).setNanos(1_000_000_000).build();

        assertThrows(IllegalArgumentException.class, () -> TimestampConverter.toInstant(timestamp));
    }

    @Test
    void toTimestampOutOfRangeTest() {
        assertThrows(IllegalArgumentException.class,
                () -> TimestampConverter.toTimestamp(Instant.parse("+10000-01-01T00:00:00Z")));
        assertThrows(IllegalArgumentException.class,
                () -> TimestampConverter.toTimestamp(Instant.parse("0001-01-01T00:00:00Z").minusNanos(1)));
    }

    @Test
    void epochNanosTest() {
        assertThat(TimestampConverter.toEpochNanos(Instant.ofEpochSecond(1234567890L, 123456789)))
                .isEqualTo(1234567890_123456789L);
        assertThat(TimestampConverter.fromEpochNanos(1234567890_123456789L))
                .isEqualTo(Instant.ofEpochSecond(1234567890L, 123456789));
        assertThat(TimestampConverter.fromEpochNanos(-1L)).isEqualTo(Instant.ofEpochSecond(-1, 999_999_999));
    }

    @Test
    void orderingIsSecondsThenNanosTest() {
        var earlier = Instant.ofEpochSecond(10, 999_999_999);
        var later = Instant.ofEpochSecond(11, 0);

        assertThat(earlier).isBefore(later);
        assertThat(TimestampConverter.toEpochNanos(earlier)).isLessThan(TimestampConverter.toEpochNanos(later));
    }
}
