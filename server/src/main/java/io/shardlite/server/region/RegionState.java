// file: server/src/main/java/io/shardlite/server/region/RegionState.java
package io.shardlite.server.region;

import java.util.Map;
import java.util.Set;

/**
 * Point-in-time view of a region.
 *
 * @param shards local shard id -> live entity ids
 */
public record RegionState(String regionId, boolean proxy, Map<String, Set<String>> shards) {
    public RegionState {
        shards = Map.copyOf(shards);
    }
}
