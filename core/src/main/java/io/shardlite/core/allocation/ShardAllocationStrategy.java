// file: core/src/main/java/io/shardlite/core/allocation/ShardAllocationStrategy.java
package io.shardlite.core.allocation;

import java.util.Map;
import java.util.Set;

/**
 * Pure decision function used by the coordinator.
 * <p>
 * Implementations must not do I/O or keep hidden state: the coordinator calls
 * them repeatedly, and a restarted coordinator replaying the same history must
 * reach the same decisions.
 */
public interface ShardAllocationStrategy {

    /**
     * Pick the owner for a shard that has none.
     *
     * @param candidates        regions eligible to host shards (non-empty)
     * @param currentAllocation shardId -> regionId for every allocated shard
     * @param shardId           the shard being allocated
     * @return one of {@code candidates}
     */
    String allocateShard(Set<String> candidates, Map<String, String> currentAllocation, String shardId);

    /**
     * Pick shards to move in this rebalance round.
     *
     * @param candidates          regions eligible to host shards
     * @param currentAllocation   shardId -> regionId for every allocated shard
     * @param shardSizes          optional shardId -> entity count; missing shards count as 0
     * @param rebalanceInProgress shards already mid-handoff; never returned
     * @return shards to hand off, possibly empty
     */
    Set<String> rebalance(Set<String> candidates,
                          Map<String, String> currentAllocation,
                          Map<String, Integer> shardSizes,
                          Set<String> rebalanceInProgress);
}
