package org.pak.brefv.core;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.pak.brefv.core.error.UnknownTagException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable mapping from short tags to fully-qualified payload type names.
 *
 * <p>Lookups never register anything and never fall back to a default type name. The backing map is copied once on
 * {@link Builder#build()} and not touched afterwards, so lookups from many threads need no locking.
 */
@ToString
@EqualsAndHashCode
public class TagRegistry {
    private static final String TAG_PATTERN = "^[a-z0-9_]+$";
    private static final String TYPE_NAME_PATTERN = "^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)+$";

    private final Map<String, String> typeNamesByTag;

    private TagRegistry(Map<String, String> typeNamesByTag) {
        this.typeNamesByTag = Collections.unmodifiableMap(new LinkedHashMap<>(typeNamesByTag));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws UnknownTagException if the tag is not registered
     */
    public String resolve(String tag) {
        var typeName = typeNamesByTag.get(tag);
        if (typeName == null) {
            throw new UnknownTagException(tag);
        }
        return typeName;
    }

    public boolean isWellKnown(String tag) {
        return typeNamesByTag.containsKey(tag);
    }

    public Set<String> tags() {
        return typeNamesByTag.keySet();
    }

    public Map<String, String> asMap() {
        return typeNamesByTag;
    }

    public int size() {
        return typeNamesByTag.size();
    }

    /**
     * New registry holding the tags of both. Fails if the two map a tag to different type names.
     */
    public TagRegistry extend(TagRegistry other) {
        return builder().tags(typeNamesByTag).tags(other.typeNamesByTag).build();
    }

    public static class Builder {
        private final Map<String, String> typeNamesByTag = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder tag(String tag, String typeName) {
            Objects.requireNonNull(tag, "tag");
            Objects.requireNonNull(typeName, "typeName");
            if (!tag.matches(TAG_PATTERN)) {
                throw new IllegalArgumentException("Tag must be lowercase letters, digits and _: " + tag);
            }
            if (!typeName.matches(TYPE_NAME_PATTERN)) {
                throw new IllegalArgumentException("Type name must be fully qualified: " + typeName);
            }

            var previous = typeNamesByTag.putIfAbsent(tag, typeName);
            if (previous != null && !previous.equals(typeName)) {
                throw new IllegalArgumentException("Tag " + tag + " is already registered as " + previous
                        + ", cannot register it as " + typeName);
            }
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            tags.forEach(this::tag);
            return this;
        }

        public TagRegistry build() {
            return new TagRegistry(typeNamesByTag);
        }
    }
}
