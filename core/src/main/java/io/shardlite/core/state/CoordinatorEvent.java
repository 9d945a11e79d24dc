// file: core/src/main/java/io/shardlite/core/state/CoordinatorEvent.java
package io.shardlite.core.state;

import java.util.Objects;

/**
 * Events persisted by the coordinator. Replaying them in order through
 * {@link ShardAllocationState#updated} rebuilds the allocation table.
 */
public sealed interface CoordinatorEvent {

    record RegionRegistered(String regionId) implements CoordinatorEvent {
        public RegionRegistered {
            Objects.requireNonNull(regionId, "regionId");
        }
    }

    record RegionTerminated(String regionId) implements CoordinatorEvent {
        public RegionTerminated {
            Objects.requireNonNull(regionId, "regionId");
        }
    }

    record ShardHomeAllocated(String shardId, String regionId) implements CoordinatorEvent {
        public ShardHomeAllocated {
            Objects.requireNonNull(shardId, "shardId");
            Objects.requireNonNull(regionId, "regionId");
        }
    }

    record ShardHomeDeallocated(String shardId) implements CoordinatorEvent {
        public ShardHomeDeallocated {
            Objects.requireNonNull(shardId, "shardId");
        }
    }

    /** Written before a handoff begins; a shard still in this state after recovery is unallocated. */
    record ShardHandOffStarted(String shardId) implements CoordinatorEvent {
        public ShardHandOffStarted {
            Objects.requireNonNull(shardId, "shardId");
        }
    }
}
