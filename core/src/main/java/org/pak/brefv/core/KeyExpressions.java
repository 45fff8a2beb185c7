package org.pak.brefv.core;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

@Slf4j
public class KeyExpressions {
    private final TagRegistry tagRegistry;

    public KeyExpressions(TagRegistry tagRegistry) {
        this.tagRegistry = tagRegistry;
    }

    public KeyExpressions() {
        this(WellKnownTags.REGISTRY);
    }

    public String pubSubKey(String basePath, String entityId, String subject, String sourceId) {
        return pubSubKey(basePath, entityId, subject, sourceId, null);
    }

    /**
     * Subjects missing from the registry are allowed, only logged.
     */
    public String pubSubKey(String basePath, String entityId, String subject, String sourceId, String targetId) {
        if (!tagRegistry.isWellKnown(subject)) {
            log.warn("Subject {} is NOT well-known!", subject);
        }
        return new PubSubKey(basePath, entityId, subject, sourceId, Optional.ofNullable(targetId)).toKey();
    }

    public String rpcKey(String basePath, String entityId, String procedure, String responderId) {
        return new RpcKey(basePath, entityId, procedure, responderId).toKey();
    }

    /**
     * Type name of the payload published on {@code key}.
     *
     * @throws org.pak.brefv.core.error.MalformedKeyException if the key is not a pub/sub key
     * @throws org.pak.brefv.core.error.UnknownTagException   if its subject is not registered
     */
    public String typeNameOf(String key) {
        return tagRegistry.resolve(PubSubKey.subjectOf(key));
    }
}
