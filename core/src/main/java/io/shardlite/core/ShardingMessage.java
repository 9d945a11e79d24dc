// file: core/src/main/java/io/shardlite/core/ShardingMessage.java
package io.shardlite.core;

import java.util.Objects;

/**
 * A message as a region sees it after running the partition functions once.
 * <p>
 * Resolution happens at the region boundary; nothing downstream inspects the
 * original message shape again.
 */
public sealed interface ShardingMessage {

    /** The message as it was handed to the region, kept for re-routing. */
    Object original();

    /** An application message for one entity. */
    record EntityDelivery(String shardId, String entityId, Object message, Object original)
            implements ShardingMessage {
        public EntityDelivery {
            Objects.requireNonNull(shardId, "shardId");
            Objects.requireNonNull(entityId, "entityId");
            Objects.requireNonNull(message, "message");
        }
    }

    /** Start (and remember) an entity without delivering anything to it. */
    record EntityStart(String shardId, String entityId, Object original) implements ShardingMessage {
        public EntityStart {
            Objects.requireNonNull(shardId, "shardId");
            Objects.requireNonNull(entityId, "entityId");
        }
    }

    /** The partition functions gave no entity id or shard id. */
    record Unroutable(Object original) implements ShardingMessage {
    }

    static ShardingMessage resolve(MessageExtractor extractor, Object message) {
        Objects.requireNonNull(message, "message");
        String entityId = extractor.entityId(message);
        String shardId = entityId == null ? null : extractor.shardId(message);
        if (entityId == null || shardId == null || entityId.isBlank() || shardId.isBlank()) {
            return new Unroutable(message);
        }
        if (message instanceof StartEntity) {
            return new EntityStart(shardId, entityId, message);
        }
        Object payload = extractor.entityMessage(message);
        if (payload == null) {
            return new Unroutable(message);
        }
        return new EntityDelivery(shardId, entityId, payload, message);
    }

    /** Shard id, or null for {@link Unroutable}. */
    default String shardId() {
        return null;
    }
}
