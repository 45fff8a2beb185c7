package org.pak.brefv.core;

import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;

import java.time.Instant;

public class TimestampConverter {
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private TimestampConverter() {
    }

    /**
     * @throws IllegalArgumentException when the instant lies outside 0001-01-01T00:00:00Z..9999-12-31T23:59:59.999999999Z
     */
    public static Timestamp toTimestamp(Instant instant) {
        return Timestamps.checkValid(Timestamp.newBuilder()
                .setSeconds(instant.getEpochSecond())
                .setNanos(instant.getNano())
                .build());
    }

    /**
     * @throws IllegalArgumentException when seconds or nanos fall outside the range protobuf allows
     */
    public static Instant toInstant(Timestamp timestamp) {
        if (!Timestamps.isValid(timestamp)) {
            throw new IllegalArgumentException("Timestamp is out of range: seconds=" + timestamp.getSeconds()
                    + ", nanos=" + timestamp.getNanos());
        }
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }

    public static long toEpochNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
    }

    public static Instant fromEpochNanos(long epochNanos) {
        return Instant.ofEpochSecond(Math.floorDiv(epochNanos, NANOS_PER_SECOND),
                Math.floorMod(epochNanos, NANOS_PER_SECOND));
    }
}
