// file: server/src/main/java/io/shardlite/server/runtime/EntityContext.java
package io.shardlite.server.runtime;

/** What an entity can see and do beyond handling its messages. */
public interface EntityContext {

    String entityId();

    String shardId();

    String regionId();

    /**
     * Ask the hosting shard to stop this entity. Messages that arrive in the
     * meantime are kept and delivered to a fresh instance afterwards.
     */
    void passivate();
}
