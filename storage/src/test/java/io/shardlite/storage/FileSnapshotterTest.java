// file: storage/src/test/java/io/shardlite/storage/FileSnapshotterTest.java
package io.shardlite.storage;

import io.shardlite.core.state.CoordinatorEvent;
import io.shardlite.core.state.ShardAllocationState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSnapshotterTest {

    @TempDir Path dir;

    @Test
    void load_latest_returns_null_when_nothing_saved() {
        assertNull(new FileSnapshotter(dir).loadLatest());
    }

    @Test
    void latest_snapshot_restores_order_and_handoff_set() throws Exception {
        ShardAllocationState state = ShardAllocationState.empty()
                .updated(new CoordinatorEvent.RegionRegistered("r1"))
                .updated(new CoordinatorEvent.RegionRegistered("r2"))
                .updated(new CoordinatorEvent.ShardHomeAllocated("b", "r2"))
                .updated(new CoordinatorEvent.ShardHomeAllocated("a", "r1"))
                .updated(new CoordinatorEvent.ShardHandOffStarted("a"));

        var snaps = new FileSnapshotter(dir);
        snaps.save(3, ShardAllocationState.empty().updated(new CoordinatorEvent.RegionRegistered("r1")));
        snaps.save(5, state);

        var loaded = new FileSnapshotter(dir).loadLatest();
        assertEquals(5, loaded.sequenceNr());
        assertEquals(state, loaded.state());
        assertEquals(List.of("b", "a"), List.copyOf(loaded.state().shards().keySet()));
        assertTrue(loaded.state().isHandOffInProgress("a"));

        try (var files = Files.list(dir)) {
            assertEquals(1, files.count(), "older snapshots are removed");
        }
    }

    @Test
    void policy_snapshots_every_n_events() {
        var snaps = new InMemorySnapshotter();
        var policy = new SnapshotPolicy(3);
        ShardAllocationState s = ShardAllocationState.empty();

        assertFalse(policy.maybeSnapshot(1, s, snaps));
        assertFalse(policy.maybeSnapshot(2, s, snaps));
        assertTrue(policy.maybeSnapshot(3, s, snaps));
        assertEquals(3, snaps.loadLatest().sequenceNr());
        assertFalse(policy.maybeSnapshot(4, s, snaps));
    }

    @Test
    void policy_rejects_non_positive_interval() {
        assertThrows(IllegalArgumentException.class, () -> new SnapshotPolicy(0));
    }
}
