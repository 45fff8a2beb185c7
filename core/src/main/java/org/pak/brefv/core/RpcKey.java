package org.pak.brefv.core;

import org.pak.brefv.core.error.MalformedKeyException;

import java.util.regex.Pattern;

/**
 * Key expression of a request-reply interaction: {@code {basePath}/@v0/{entityId}/@rpc/{procedure}/{responderId}}.
 */
public record RpcKey(String basePath, String entityId, String procedure, String responderId) {
    public static final String FORMAT = "{basePath}/@v0/{entityId}/@rpc/{procedure}/{responderId}";

    private static final Pattern PATTERN = Pattern.compile(
            "^(?<basePath>.+?)/@v0/(?<entityId>[^/]+)/@rpc/(?<procedure>[^/]+)/(?<responderId>.+)$");

    public static RpcKey parse(String key) {
        var matcher = PATTERN.matcher(key);
        if (!matcher.matches()) {
            throw new MalformedKeyException(key, FORMAT);
        }
        return new RpcKey(matcher.group("basePath"), matcher.group("entityId"), matcher.group("procedure"),
                matcher.group("responderId"));
    }

    public String toKey() {
        return basePath + "/@v0/" + entityId + "/@rpc/" + procedure + "/" + responderId;
    }
}
