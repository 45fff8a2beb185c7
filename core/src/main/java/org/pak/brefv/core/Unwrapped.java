package org.pak.brefv.core;

import com.google.protobuf.ByteString;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of {@link EnvelopeCodec#unwrap(byte[])}. {@code receivedAt} is normally not before
 * {@code enclosedAt}, but clocks of producer and consumer may be skewed and nothing enforces it.
 */
public record Unwrapped(Instant receivedAt, Instant enclosedAt, ByteString payload) {

    public byte[] payloadBytes() {
        return payload.toByteArray();
    }

    /**
     * Negative when the producer clock runs ahead of the consumer clock.
     */
    public Duration latency() {
        return Duration.between(enclosedAt, receivedAt);
    }
}
