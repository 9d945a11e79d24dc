// file: core/src/main/java/io/shardlite/core/StartEntity.java
package io.shardlite.core;

import java.util.Objects;

/**
 * Asks the owning shard to start an entity without delivering an application
 * message to it. Routed like any other message, so extractors must map it to the
 * same shard as the entity's regular traffic.
 */
public record StartEntity(String entityId) {
    public StartEntity {
        Objects.requireNonNull(entityId, "entityId");
        if (entityId.isBlank()) throw new IllegalArgumentException("entityId must not be blank");
    }
}
