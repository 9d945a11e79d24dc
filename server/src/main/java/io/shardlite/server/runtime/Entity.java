// file: server/src/main/java/io/shardlite/server/runtime/Entity.java
package io.shardlite.server.runtime;

/**
 * Application behaviour of one sharded entity.
 * <p>
 * Called by exactly one thread at a time. A RuntimeException thrown from
 * {@link #onMessage} is logged and the entity keeps its state and continues.
 */
public interface Entity {

    void onMessage(Object message);

    /** Last callback before the handle is discarded (passivation, handoff, shutdown). */
    default void postStop() {
    }
}
