package org.pak.brefv.payloads;

import com.google.protobuf.ByteString;
import com.google.protobuf.DynamicMessage;
import com.google.protobuf.Message;
import lombok.extern.slf4j.Slf4j;
import org.pak.brefv.core.EnvelopeCodec;
import org.pak.brefv.core.PubSubKey;
import org.pak.brefv.core.TagRegistry;
import org.pak.brefv.core.TimestampConverter;
import org.pak.brefv.core.WellKnownTags;
import org.slf4j.MDC;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encloses and uncovers payloads addressed by pub/sub key. The subject of the key is the tag that selects the
 * payload type.
 *
 * <p>Text and base64 renditions exist only for the {@value WellKnownTags#RAW} subject, whose payload is a
 * {@code keelson.TimestampedBytes}. JSON works for every registered subject whose type {@link PayloadTypes} knows.
 */
@Slf4j
public class TypedEnvelopeCodec {
    private static final String TIMESTAMP_FIELD = "timestamp";
    private static final String VALUE_FIELD = "value";

    private final EnvelopeCodec envelopeCodec;
    private final TagRegistry tagRegistry;
    private final PayloadCodec payloadCodec;

    public TypedEnvelopeCodec(EnvelopeCodec envelopeCodec, TagRegistry tagRegistry, PayloadCodec payloadCodec) {
        this.envelopeCodec = envelopeCodec;
        this.tagRegistry = tagRegistry;
        this.payloadCodec = payloadCodec;
    }

    public TypedEnvelopeCodec() {
        this(new EnvelopeCodec(), WellKnownTags.REGISTRY, new PayloadCodec());
    }

    /**
     * @throws IllegalArgumentException if the payload type differs from the one the key's subject resolves to
     */
    public byte[] enclose(String key, Message payload) {
        var subject = PubSubKey.subjectOf(key);
        try (var ignoredTagMDC = MDC.putCloseable("tag", subject)) {
            var typeName = tagRegistry.resolve(subject);
            var actualTypeName = payload.getDescriptorForType().getFullName();
            if (!typeName.equals(actualTypeName)) {
                throw new IllegalArgumentException("Subject " + subject + " carries " + typeName
                        + ", got " + actualTypeName);
            }

            try (var ignoredTypeNameMDC = MDC.putCloseable("typeName", typeName)) {
                log.debug("Enclose {}", typeName);
                return envelopeCodec.enclose(payload.toByteString());
            }
        }
    }

    public DecodedEnvelope uncover(String key, byte[] message) {
        var subject = PubSubKey.subjectOf(key);
        try (var ignoredTagMDC = MDC.putCloseable("tag", subject)) {
            var typeName = tagRegistry.resolve(subject);
            try (var ignoredTypeNameMDC = MDC.putCloseable("typeName", typeName)) {
                var unwrapped = envelopeCodec.unwrap(message);
                var payload = payloadCodec.decode(unwrapped.payload(), typeName);

                log.debug("Uncovered {} enclosed at {}", typeName, unwrapped.enclosedAt());
                return new DecodedEnvelope(unwrapped.receivedAt(), unwrapped.enclosedAt(), typeName, payload);
            }
        }
    }

    public byte[] encloseFromText(String key, String text) {
        requireRawSubject(key, "enclose-from-text");
        return encloseRaw(ByteString.copyFromUtf8(text));
    }

    public byte[] encloseFromBase64(String key, String base64) {
        requireRawSubject(key, "enclose-from-base64");
        return encloseRaw(ByteString.copyFrom(Base64.getDecoder().decode(base64)));
    }

    public byte[] encloseFromJson(String key, String json) {
        var subject = PubSubKey.subjectOf(key);
        try (var ignoredTagMDC = MDC.putCloseable("tag", subject)) {
            var typeName = tagRegistry.resolve(subject);
            try (var ignoredTypeNameMDC = MDC.putCloseable("typeName", typeName)) {
                var payload = payloadCodec.fromJson(json, typeName);

                log.debug("Enclose {} from JSON", typeName);
                return envelopeCodec.enclose(payload.toByteString());
            }
        }
    }

    public String uncoverToText(String key, byte[] message) {
        requireRawSubject(key, "uncover-to-text");
        return uncoverRaw(key, message).toString(StandardCharsets.UTF_8);
    }

    public String uncoverToBase64(String key, byte[] message) {
        requireRawSubject(key, "uncover-to-base64");
        return Base64.getEncoder().encodeToString(uncoverRaw(key, message).toByteArray());
    }

    public String uncoverToJson(String key, byte[] message) {
        return payloadCodec.toJson(uncover(key, message).payload());
    }

    private byte[] encloseRaw(ByteString value) {
        var builder = payloadCodec.newBuilder(tagRegistry.resolve(WellKnownTags.RAW));
        var descriptor = builder.getDescriptorForType();
        var payload = builder
                .setField(descriptor.findFieldByName(TIMESTAMP_FIELD),
                        TimestampConverter.toTimestamp(envelopeCodec.timeSource().now()))
                .setField(descriptor.findFieldByName(VALUE_FIELD), value)
                .build();

        return envelopeCodec.enclose(payload.toByteString());
    }

    private ByteString uncoverRaw(String key, byte[] message) {
        DynamicMessage payload = uncover(key, message).payload();
        return (ByteString) payload.getField(payload.getDescriptorForType().findFieldByName(VALUE_FIELD));
    }

    private void requireRawSubject(String key, String operation) {
        var subject = PubSubKey.subjectOf(key);
        if (!WellKnownTags.RAW.equals(subject)) {
            throw new IllegalArgumentException(operation + " can only be used together with a '" + WellKnownTags.RAW
                    + "' subject! You tried to use it with '" + subject + "'");
        }

        var typeName = tagRegistry.resolve(WellKnownTags.RAW);
        if (!WellKnownTags.TIMESTAMPED_BYTES.equals(typeName)) {
            throw new IllegalArgumentException(operation + " needs the '" + WellKnownTags.RAW + "' subject to carry "
                    + WellKnownTags.TIMESTAMPED_BYTES + ", it is registered as " + typeName);
        }
    }
}
