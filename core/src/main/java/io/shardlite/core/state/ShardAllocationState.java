// file: core/src/main/java/io/shardlite/core/state/ShardAllocationState.java
package io.shardlite.core.state;

import io.shardlite.core.exception.AllocationConflictException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable shard-to-region allocation table.
 * <p>
 * This is the coordinator's authoritative state, reduced to a value object:
 *  - regions: registered host regions, each with the shards it owns, in
 *    allocation order.
 *  - shards: shardId -> owning regionId, in allocation order.
 *  - handOffInProgress: shards whose handoff has started but not finished.
 * <p>
 * Design:
 *  - {@link #updated(CoordinatorEvent)} is a pure function, so the same event
 *    sequence always rebuilds the same table (the journal round-trip property).
 *  - Every update copies; callers can share instances freely across threads.
 */
public final class ShardAllocationState {

    private static final ShardAllocationState EMPTY =
            new ShardAllocationState(Map.of(), Map.of(), Set.of());

    private final Map<String, List<String>> regions;
    private final Map<String, String> shards;
    private final Set<String> handOffInProgress;

    private ShardAllocationState(Map<String, List<String>> regions,
                                 Map<String, String> shards,
                                 Set<String> handOffInProgress) {
        this.regions = regions;
        this.shards = shards;
        this.handOffInProgress = handOffInProgress;
    }

    public static ShardAllocationState empty() {
        return EMPTY;
    }

    /**
     * Rebuild a state from its parts, e.g. when loading a snapshot.
     * Allocation order is taken from the iteration order of {@code shards}.
     */
    public static ShardAllocationState of(Set<String> regionIds,
                                          Map<String, String> shards,
                                          Set<String> handOffInProgress) {
        ShardAllocationState s = empty();
        for (String r : regionIds) {
            s = s.updated(new CoordinatorEvent.RegionRegistered(r));
        }
        for (Map.Entry<String, String> e : shards.entrySet()) {
            s = s.updated(new CoordinatorEvent.ShardHomeAllocated(e.getKey(), e.getValue()));
        }
        for (String shardId : handOffInProgress) {
            s = s.updated(new CoordinatorEvent.ShardHandOffStarted(shardId));
        }
        return s;
    }

    /**
     * Apply one event and return the resulting state.
     *
     * @throws AllocationConflictException if a shard is allocated while already owned
     * @throws IllegalStateException       if the event references an unknown region or shard
     */
    public ShardAllocationState updated(CoordinatorEvent event) {
        Objects.requireNonNull(event, "event");

        if (event instanceof CoordinatorEvent.RegionRegistered e) {
            if (regions.containsKey(e.regionId())) {
                return this;
            }
            var newRegions = copyRegions();
            newRegions.put(e.regionId(), List.of());
            return new ShardAllocationState(freeze(newRegions), shards, handOffInProgress);
        }

        if (event instanceof CoordinatorEvent.RegionTerminated e) {
            List<String> owned = regions.get(e.regionId());
            if (owned == null) {
                return this;
            }
            var newRegions = copyRegions();
            newRegions.remove(e.regionId());
            var newShards = new LinkedHashMap<>(shards);
            var newHandOff = new LinkedHashSet<>(handOffInProgress);
            for (String shardId : owned) {
                newShards.remove(shardId);
                newHandOff.remove(shardId);
            }
            return new ShardAllocationState(freeze(newRegions),
                    Collections.unmodifiableMap(newShards),
                    Collections.unmodifiableSet(newHandOff));
        }

        if (event instanceof CoordinatorEvent.ShardHomeAllocated e) {
            String existing = shards.get(e.shardId());
            if (existing != null) {
                throw new AllocationConflictException(e.shardId(), existing, e.regionId());
            }
            List<String> owned = regions.get(e.regionId());
            if (owned == null) {
                throw new IllegalStateException("region " + e.regionId() + " not registered");
            }
            var newRegions = copyRegions();
            var newOwned = new ArrayList<>(owned);
            newOwned.add(e.shardId());
            newRegions.put(e.regionId(), List.copyOf(newOwned));
            var newShards = new LinkedHashMap<>(shards);
            newShards.put(e.shardId(), e.regionId());
            return new ShardAllocationState(freeze(newRegions),
                    Collections.unmodifiableMap(newShards), handOffInProgress);
        }

        if (event instanceof CoordinatorEvent.ShardHomeDeallocated e) {
            String owner = shards.get(e.shardId());
            if (owner == null) {
                throw new IllegalStateException("shard " + e.shardId() + " not allocated");
            }
            var newRegions = copyRegions();
            var newOwned = new ArrayList<>(regions.get(owner));
            newOwned.remove(e.shardId());
            newRegions.put(owner, List.copyOf(newOwned));
            var newShards = new LinkedHashMap<>(shards);
            newShards.remove(e.shardId());
            var newHandOff = new LinkedHashSet<>(handOffInProgress);
            newHandOff.remove(e.shardId());
            return new ShardAllocationState(freeze(newRegions),
                    Collections.unmodifiableMap(newShards),
                    Collections.unmodifiableSet(newHandOff));
        }

        if (event instanceof CoordinatorEvent.ShardHandOffStarted e) {
            if (!shards.containsKey(e.shardId())) {
                throw new IllegalStateException("shard " + e.shardId() + " not allocated");
            }
            if (handOffInProgress.contains(e.shardId())) {
                return this;
            }
            var newHandOff = new LinkedHashSet<>(handOffInProgress);
            newHandOff.add(e.shardId());
            return new ShardAllocationState(regions, shards, Collections.unmodifiableSet(newHandOff));
        }

        throw new IllegalArgumentException("unknown event type: " + event.getClass().getName());
    }

    public Map<String, List<String>> regions() {
        return regions;
    }

    public Map<String, String> shards() {
        return shards;
    }

    public Set<String> handOffInProgress() {
        return handOffInProgress;
    }

    /** @return owning regionId, or null if the shard is unallocated. */
    public String ownerOf(String shardId) {
        return shards.get(shardId);
    }

    public List<String> shardsOf(String regionId) {
        return regions.getOrDefault(regionId, List.of());
    }

    public boolean isRegistered(String regionId) {
        return regions.containsKey(regionId);
    }

    public boolean isHandOffInProgress(String shardId) {
        return handOffInProgress.contains(shardId);
    }

    private LinkedHashMap<String, List<String>> copyRegions() {
        return new LinkedHashMap<>(regions);
    }

    private static Map<String, List<String>> freeze(LinkedHashMap<String, List<String>> m) {
        return Collections.unmodifiableMap(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShardAllocationState other)) return false;
        return regions.equals(other.regions)
                && shards.equals(other.shards)
                && handOffInProgress.equals(other.handOffInProgress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(regions, shards, handOffInProgress);
    }

    @Override
    public String toString() {
        return "ShardAllocationState[regions=" + regions + ", inHandOff=" + handOffInProgress + "]";
    }
}
