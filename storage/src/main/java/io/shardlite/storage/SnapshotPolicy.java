// file: storage/src/main/java/io/shardlite/storage/SnapshotPolicy.java
package io.shardlite.storage;

import io.shardlite.core.state.ShardAllocationState;

/**
 * Snapshot policy that triggers a full snapshot after every N persisted events.
 * <p>
 * Bounds worst-case recovery time by limiting journal replay length. Not
 * thread-safe; owned by the single coordinator instance that persists.
 */
public final class SnapshotPolicy {
    private final int everyEvents;
    private int sinceLast;

    public SnapshotPolicy(int everyEvents) {
        if (everyEvents <= 0) throw new IllegalArgumentException("everyEvents must be > 0");
        this.everyEvents = everyEvents;
    }

    /**
     * Call after each successful journal append.
     *
     * @return true if a snapshot was written
     */
    public boolean maybeSnapshot(long sequenceNr, ShardAllocationState state, Snapshotter snaps) {
        if (++sinceLast >= everyEvents) {
            snaps.save(sequenceNr, state);
            sinceLast = 0;
            return true;
        }
        return false;
    }
}
