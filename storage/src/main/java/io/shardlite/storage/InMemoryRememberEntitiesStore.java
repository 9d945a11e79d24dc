// file: storage/src/main/java/io/shardlite/storage/InMemoryRememberEntitiesStore.java
package io.shardlite.storage;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local store, shared by all regions of a test cluster. */
public class InMemoryRememberEntitiesStore implements RememberEntitiesStore {

    private final Map<String, Set<String>> byShard = new ConcurrentHashMap<>();

    @Override
    public Set<String> load(String shardId) {
        Set<String> ids = byShard.get(shardId);
        if (ids == null) return Set.of();
        synchronized (ids) {
            return Set.copyOf(ids);
        }
    }

    @Override
    public void update(String shardId, Set<String> started, Set<String> stopped) {
        Set<String> ids = byShard.computeIfAbsent(shardId, k -> new HashSet<>());
        synchronized (ids) {
            ids.addAll(started);
            ids.removeAll(stopped);
        }
    }
}
