// file: storage/src/main/java/io/shardlite/storage/RememberEntitiesStore.java
package io.shardlite.storage;

import java.util.Set;

/**
 * Durable record of which entity ids exist within each shard, so a shard
 * started elsewhere (after handoff or node loss) can recreate them.
 * <p>
 * Contract:
 *  - update() is durable before it returns.
 *  - load() returns every id started and not stopped since, in any order.
 *  - Failures surface as {@link io.shardlite.core.exception.PersistenceFailureException}.
 */
public interface RememberEntitiesStore extends AutoCloseable {

    Set<String> load(String shardId);

    void update(String shardId, Set<String> started, Set<String> stopped);

    @Override
    default void close() {
    }
}
