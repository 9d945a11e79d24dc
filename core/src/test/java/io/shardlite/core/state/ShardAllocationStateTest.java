// file: core/src/test/java/io/shardlite/core/state/ShardAllocationStateTest.java
package io.shardlite.core.state;

import io.shardlite.core.exception.AllocationConflictException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ShardAllocationStateTest {

    private static ShardAllocationState twoRegionsThreeShards() {
        return ShardAllocationState.empty()
                .updated(new CoordinatorEvent.RegionRegistered("r1"))
                .updated(new CoordinatorEvent.RegionRegistered("r2"))
                .updated(new CoordinatorEvent.ShardHomeAllocated("s1", "r1"))
                .updated(new CoordinatorEvent.ShardHomeAllocated("s2", "r2"))
                .updated(new CoordinatorEvent.ShardHomeAllocated("s3", "r1"));
    }

    @Test
    void regions_and_shards_stay_mutually_consistent() {
        var s = twoRegionsThreeShards();
        assertEquals(List.of("s1", "s3"), s.shardsOf("r1"));
        assertEquals(List.of("s2"), s.shardsOf("r2"));
        assertEquals(Map.of("s1", "r1", "s2", "r2", "s3", "r1"), s.shards());
        assertEquals("r2", s.ownerOf("s2"));
        assertNull(s.ownerOf("s9"));
    }

    @Test
    void registering_twice_is_a_no_op() {
        var s = twoRegionsThreeShards();
        assertSame(s, s.updated(new CoordinatorEvent.RegionRegistered("r1")));
    }

    @Test
    void allocating_an_owned_shard_is_a_conflict() {
        var s = twoRegionsThreeShards();
        var e = assertThrows(AllocationConflictException.class,
                () -> s.updated(new CoordinatorEvent.ShardHomeAllocated("s1", "r2")));
        assertTrue(e.getMessage().contains("s1"));
    }

    @Test
    void allocating_to_an_unknown_region_is_rejected() {
        assertThrows(IllegalStateException.class, () -> ShardAllocationState.empty()
                .updated(new CoordinatorEvent.ShardHomeAllocated("s1", "nowhere")));
    }

    @Test
    void terminating_a_region_drops_its_shards_and_their_handoffs() {
        var s = twoRegionsThreeShards()
                .updated(new CoordinatorEvent.ShardHandOffStarted("s1"))
                .updated(new CoordinatorEvent.RegionTerminated("r1"));
        assertFalse(s.isRegistered("r1"));
        assertEquals(Map.of("s2", "r2"), s.shards());
        assertEquals(Set.of(), s.handOffInProgress());
        assertSame(s, s.updated(new CoordinatorEvent.RegionTerminated("r1")));
    }

    @Test
    void deallocation_clears_the_handoff_marker() {
        var s = twoRegionsThreeShards()
                .updated(new CoordinatorEvent.ShardHandOffStarted("s2"));
        assertTrue(s.isHandOffInProgress("s2"));

        var after = s.updated(new CoordinatorEvent.ShardHomeDeallocated("s2"));
        assertFalse(after.isHandOffInProgress("s2"));
        assertNull(after.ownerOf("s2"));
        assertEquals(List.of(), after.shardsOf("r2"));
        assertTrue(after.isRegistered("r2"));
    }

    @Test
    void handoff_of_unallocated_shard_is_rejected() {
        assertThrows(IllegalStateException.class,
                () -> twoRegionsThreeShards().updated(new CoordinatorEvent.ShardHandOffStarted("s9")));
        assertThrows(IllegalStateException.class,
                () -> twoRegionsThreeShards().updated(new CoordinatorEvent.ShardHomeDeallocated("s9")));
    }

    @Test
    void state_is_immutable_and_compares_by_value() {
        var a = twoRegionsThreeShards();
        var b = twoRegionsThreeShards();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertThrows(UnsupportedOperationException.class, () -> a.shards().put("x", "r1"));
        assertThrows(UnsupportedOperationException.class, () -> a.regions().remove("r1"));

        var rebuilt = ShardAllocationState.of(Set.of("r1", "r2"), a.shards(), Set.of());
        assertEquals(a, rebuilt);
    }
}
