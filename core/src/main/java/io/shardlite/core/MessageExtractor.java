// file: core/src/main/java/io/shardlite/core/MessageExtractor.java
package io.shardlite.core;

/**
 * Partition functions supplied by the application.
 * <p>
 * Contract:
 *  - All three methods must be pure and deterministic: the same message always
 *    yields the same entity id and shard id, on every node, for the lifetime of
 *    the cluster.
 *  - Returning null from {@link #entityId} or {@link #shardId} means the message
 *    cannot be routed; the region reports it as undeliverable.
 */
public interface MessageExtractor {

    /**
     * @return the id of the entity this message is addressed to, or null.
     */
    String entityId(Object message);

    /**
     * The message actually handed to the entity. Implementations may unwrap an
     * envelope here; the default is the message itself.
     */
    default Object entityMessage(Object message) {
        return message;
    }

    /**
     * @return the shard id the message belongs to, or null.
     */
    String shardId(Object message);
}
