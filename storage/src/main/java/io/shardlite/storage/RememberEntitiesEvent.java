// file: storage/src/main/java/io/shardlite/storage/RememberEntitiesEvent.java
package io.shardlite.storage;

import java.util.Set;

/**
 * Journal events of a {@link JournalRememberEntitiesStore}: one per update,
 * naming the entity ids that started or stopped in a shard.
 */
public sealed interface RememberEntitiesEvent {

    Set<String> entityIds();

    record EntitiesStarted(Set<String> entityIds) implements RememberEntitiesEvent {
        public EntitiesStarted {
            entityIds = Set.copyOf(entityIds);
        }
    }

    record EntitiesStopped(Set<String> entityIds) implements RememberEntitiesEvent {
        public EntitiesStopped {
            entityIds = Set.copyOf(entityIds);
        }
    }
}
