// file: core/src/main/java/io/shardlite/core/ShardingEnvelope.java
package io.shardlite.core;

import java.util.Objects;

/**
 * Generic envelope for applications that do not want to write their own
 * {@link MessageExtractor}. {@link HashCodeMessageExtractor} understands it.
 */
public record ShardingEnvelope(String entityId, Object message) {
    public ShardingEnvelope {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(message, "message");
        if (entityId.isBlank()) throw new IllegalArgumentException("entityId must not be blank");
    }
}
