package org.pak.brefv.core;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.ExtensionRegistryLite;
import com.google.protobuf.Timestamp;
import com.google.protobuf.WireFormat;
import lombok.extern.slf4j.Slf4j;
import org.pak.brefv.core.error.MalformedEnvelopeException;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;

/**
 * Seals opaque payloads into envelopes and recovers them.
 *
 * <p>The wire form is the protobuf message
 * <pre>
 * message Envelope {
 *     google.protobuf.Timestamp enclosed_at = 1;
 *     bytes payload = 2;
 * }
 * </pre>
 * Field 1 is always written, field 2 only when the payload is not empty. Unknown fields are skipped on read.
 *
 * <p>Instances hold no mutable state and can be shared between threads.
 */
@Slf4j
public class EnvelopeCodec {
    static final int ENCLOSED_AT_FIELD = 1;
    static final int PAYLOAD_FIELD = 2;
    private static final int ENCLOSED_AT_TAG = ENCLOSED_AT_FIELD << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;
    private static final int PAYLOAD_TAG = PAYLOAD_FIELD << 3 | WireFormat.WIRETYPE_LENGTH_DELIMITED;

    private final TimeSource timeSource;
    private final int maxEnvelopeSize;

    public EnvelopeCodec(EnvelopeCodecConfig config) {
        this.timeSource = config.getTimeSource();
        this.maxEnvelopeSize = config.getMaxEnvelopeSize();
    }

    public EnvelopeCodec(TimeSource timeSource) {
        this(EnvelopeCodecConfig.builder().timeSource(timeSource).build());
    }

    public EnvelopeCodec() {
        this(EnvelopeCodecConfig.builder().build());
    }

    public TimeSource timeSource() {
        return timeSource;
    }

    public byte[] enclose(byte[] payload) {
        return enclose(ByteString.copyFrom(payload));
    }

    public byte[] enclose(ByteString payload) {
        Objects.requireNonNull(payload, "payload");
        return encode(new Envelope(timeSource.now(), payload));
    }

    /**
     * @throws IllegalArgumentException if {@code enclosedAt} is outside the range a protobuf Timestamp can carry
     */
    public byte[] enclose(byte[] payload, Instant enclosedAt) {
        return encode(Envelope.of(enclosedAt, payload));
    }

    /**
     * @throws MalformedEnvelopeException if {@code message} is not a complete envelope
     */
    public Unwrapped unwrap(byte[] message) {
        var receivedAt = timeSource.now();
        var envelope = decode(message);

        return new Unwrapped(receivedAt, envelope.enclosedAt(), envelope.payload());
    }

    public byte[] encode(Envelope envelope) {
        var enclosedAt = TimestampConverter.toTimestamp(envelope.enclosedAt());
        var payload = envelope.payload();

        var size = CodedOutputStream.computeMessageSize(ENCLOSED_AT_FIELD, enclosedAt);
        if (!payload.isEmpty()) {
            size += CodedOutputStream.computeBytesSize(PAYLOAD_FIELD, payload);
        }

        var buffer = new byte[size];
        var output = CodedOutputStream.newInstance(buffer);
        try {
            output.writeMessage(ENCLOSED_AT_FIELD, enclosedAt);
            if (!payload.isEmpty()) {
                output.writeBytes(PAYLOAD_FIELD, payload);
            }
            output.checkNoSpaceLeft();
        } catch (IOException e) {
            throw new IllegalStateException("Writing an envelope to a byte array failed", e);
        }

        log.debug("Enclosed {} payload bytes at {}", payload.size(), envelope.enclosedAt());
        return buffer;
    }

    /**
     * @throws MalformedEnvelopeException if {@code message} is not a complete envelope
     */
    public Envelope decode(byte[] message) {
        Objects.requireNonNull(message, "message");
        if (message.length > maxEnvelopeSize) {
            throw new MalformedEnvelopeException("Envelope of " + message.length
                    + " bytes exceeds the limit of " + maxEnvelopeSize + " bytes");
        }

        Timestamp.Builder enclosedAt = null;
        var payload = ByteString.EMPTY;

        var input = CodedInputStream.newInstance(message);
        try {
            var done = false;
            while (!done) {
                var tag = input.readTag();
                switch (tag) {
                    case 0 -> done = true;
                    case ENCLOSED_AT_TAG -> {
                        if (enclosedAt == null) {
                            enclosedAt = Timestamp.newBuilder();
                        }
                        input.readMessage(enclosedAt, ExtensionRegistryLite.getEmptyRegistry());
                    }
                    case PAYLOAD_TAG -> payload = input.readBytes();
                    default -> {
                        if (!input.skipField(tag)) {
                            throw new MalformedEnvelopeException("Unexpected end-group tag in envelope");
                        }
                    }
                }
            }
        } catch (IOException e) {
            throw new MalformedEnvelopeException("Could not parse envelope: " + e.getMessage(), e);
        }

        if (enclosedAt == null) {
            throw new MalformedEnvelopeException("Envelope has no enclosed_at timestamp");
        }

        try {
            return new Envelope(TimestampConverter.toInstant(enclosedAt.build()), payload);
        } catch (IllegalArgumentException e) {
            throw new MalformedEnvelopeException("Envelope carries an invalid enclosed_at: " + e.getMessage(), e);
        }
    }
}
