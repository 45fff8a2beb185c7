package org.pak.brefv.core;

import org.pak.brefv.core.error.MalformedKeyException;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Key expression of a publish-subscribe interaction:
 * {@code {basePath}/@v0/{entityId}/pubsub/{subject}/{sourceId}[/@target/{targetId}]}.
 * The subject is the tag naming the payload type.
 */
public record PubSubKey(String basePath, String entityId, String subject, String sourceId, Optional<String> targetId) {
    public static final String FORMAT = "{basePath}/@v0/{entityId}/pubsub/{subject}/{sourceId}";

    private static final Pattern PATTERN = Pattern.compile(
            "^(?<basePath>.+?)/@v0/(?<entityId>[^/]+)/pubsub/(?<subject>[^/]+)/(?<sourceId>.+?)"
                    + "(?:/@target/(?<targetId>[^/]+))?$");

    public PubSubKey(String basePath, String entityId, String subject, String sourceId) {
        this(basePath, entityId, subject, sourceId, Optional.empty());
    }

    /**
     * @throws MalformedKeyException if the key does not follow {@link #FORMAT}
     */
    public static PubSubKey parse(String key) {
        var matcher = PATTERN.matcher(key);
        if (!matcher.matches()) {
            throw new MalformedKeyException(key, FORMAT);
        }
        return new PubSubKey(matcher.group("basePath"), matcher.group("entityId"), matcher.group("subject"),
                matcher.group("sourceId"), Optional.ofNullable(matcher.group("targetId")));
    }

    public static String subjectOf(String key) {
        return parse(key).subject();
    }

    public String toKey() {
        var key = basePath + "/@v0/" + entityId + "/pubsub/" + subject + "/" + sourceId;
        return targetId.map(target -> key + "/@target/" + target).orElse(key);
    }
}
