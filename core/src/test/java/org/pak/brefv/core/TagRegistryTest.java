package org.pak.brefv.core;

import org.junit.jupiter.api.Test;
import org.pak.brefv.core.error.UnknownTagException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TagRegistryTest {
    TagRegistry registry = TagRegistry.builder()
            .tag("lever_position_pct", "keelson.TimestampedFloat")
            .tag("raw", "keelson.TimestampedBytes")
            .build();

    @Test
    void resolveTest() {
        assertThat(registry.resolve("lever_position_pct")).isEqualTo("keelson.TimestampedFloat");
        assertThat(registry.resolve("raw")).isEqualTo("keelson.TimestampedBytes");
    }

    @Test
    void resolveUnknownTest() {
        var exception = assertThrows(UnknownTagException.class, () -> registry.resolve("nonexistent-tag"));

        assertThat(exception.getTag()).isEqualTo("nonexistent-tag");
        assertThat(exception.getMessage()).isEqualTo("Tag 'nonexistent-tag' is not well-known");
        assertThat(registry.isWellKnown("nonexistent-tag")).isFalse();
    }

    @Test
    void immutableTest() {
        assertThrows(UnsupportedOperationException.class, () -> registry.asMap().put("other", "a.B"));
        assertThrows(UnsupportedOperationException.class, () -> registry.tags().remove("raw"));
    }

    @Test
    void builderIsDetachedTest() {
        var builder = TagRegistry.builder().tag("raw", "keelson.TimestampedBytes");
        var built = builder.build();
        builder.tag("other", "keelson.TimestampedString");

        assertThat(built.size()).isEqualTo(1);
        assertThat(built.isWellKnown("other")).isFalse();
    }

    @Test
    void invalidTagTest() {
        var exception = assertThrows(IllegalArgumentException.class,
                () -> TagRegistry.builder().tag("Not-A-Tag", "keelson.TimestampedFloat"));

        assertThat(exception.getMessage()).isEqualTo("Tag must be lowercase letters, digits and _: Not-A-Tag");
    }

    @Test
    void invalidTypeNameTest() {
        assertThrows(IllegalArgumentException.class, () -> TagRegistry.builder().tag("raw", "TimestampedBytes"));
        assertThrows(IllegalArgumentException.class, () -> TagRegistry.builder().tag("raw", "keelson..Bytes"));
    }

    @Test
    void conflictingTagTest() {
        var builder = TagRegistry.builder()
                .tag("raw", "keelson.TimestampedBytes")
                .tag("raw", "keelson.TimestampedBytes");

        var exception = assertThrows(IllegalArgumentException.class,
                () -> builder.tag("raw", "keelson.TimestampedString"));

        assertThat(exception.getMessage()).isEqualTo("Tag raw is already registered as keelson.TimestampedBytes,"
                + " cannot register it as keelson.TimestampedString");
    }

    @Test
    void extendTest() {
        var extension = TagRegistry.builder().tags(Map.of("my_custom_tag", "acme.Custom")).build();

        var extended = registry.extend(extension);

        assertThat(extended.resolve("my_custom_tag")).isEqualTo("acme.Custom");
        assertThat(extended.resolve("raw")).isEqualTo("keelson.TimestampedBytes");
        assertThat(registry.isWellKnown("my_custom_tag")).isFalse();
    }
}
