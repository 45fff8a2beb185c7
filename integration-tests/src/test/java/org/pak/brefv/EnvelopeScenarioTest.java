package org.pak.brefv;

import org.junit.jupiter.api.Test;
import org.pak.brefv.core.EnvelopeCodec;
import org.pak.brefv.core.SystemTimeSource;
import org.pak.brefv.core.TimestampConverter;
import org.pak.brefv.core.WellKnownTags;
import org.pak.brefv.payloads.PayloadCodec;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class EnvelopeScenarioTest {
    EnvelopeCodec envelopeCodec = new EnvelopeCodec();
    PayloadCodec payloadCodec = new PayloadCodec();
    TimestampedFloatPayload floats = new TimestampedFloatPayload(payloadCodec);

    @Test
    void encloseTest() {
        var test = "test".getBytes(StandardCharsets.UTF_8);

        var message = envelopeCodec.enclose(test);
        var unwrapped = envelopeCodec.unwrap(message);

        assertThat(unwrapped.payloadBytes()).isEqualTo(test);
        assertThat(unwrapped.receivedAt()).isAfterOrEqualTo(unwrapped.enclosedAt());
    }

    @Test
    void actualPayloadTest() {
        var data = floats.create(TimestampConverter.toTimestamp(SystemTimeSource.INSTANCE.now()), 3.14f);

        var message = envelopeCodec.enclose(data.toByteArray());
        var unwrapped = envelopeCodec.unwrap(message);

        var typeName = WellKnownTags.REGISTRY.resolve("heading_true_north_deg");
        var content = payloadCodec.decode(unwrapped.payload(), typeName);

        assertThat(TimestampedFloatPayload.value(content)).isEqualTo(3.14f);
        assertThat(TimestampedFloatPayload.timestamp(content)).isEqualTo(TimestampedFloatPayload.timestamp(data));

        var innerTimestamp = TimestampConverter.toInstant(TimestampedFloatPayload.timestamp(content));
        assertThat(innerTimestamp).isBeforeOrEqualTo(unwrapped.enclosedAt());
        assertThat(unwrapped.enclosedAt()).isBeforeOrEqualTo(unwrapped.receivedAt());
    }
}
