package org.pak.brefv.core;

import com.google.protobuf.ByteString;

import java.time.Instant;
import java.util.Objects;

/**
 * A payload sealed with the moment it was enclosed. The payload is never interpreted.
 */
public record Envelope(Instant enclosedAt, ByteString payload) {
    public Envelope {
        Objects.requireNonNull(enclosedAt, "enclosedAt");
        Objects.requireNonNull(payload, "payload");
    }

    public static Envelope of(Instant enclosedAt, byte[] payload) {
        return new Envelope(enclosedAt, ByteString.copyFrom(payload));
    }
}
