// file: storage/src/main/java/io/shardlite/storage/Snapshotter.java
package io.shardlite.storage;

import io.shardlite.core.state.ShardAllocationState;

/**
 * Snapshot abstraction to bound coordinator recovery time.
 * <p>
 * A snapshot is the full allocation table as of some journal sequence number.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay journal events written after that sequence number.
 */
public interface Snapshotter {

    /**
     * Persist the state reached after applying events up to {@code sequenceNr}.
     *
     * @return snapshot identifier (e.g., filename).
     */
    String save(long sequenceNr, ShardAllocationState state);

    /** Load the latest snapshot, or null if none was written. */
    LoadedSnapshot loadLatest();

    /** Snapshot with the journal position it covers. */
    record LoadedSnapshot(long sequenceNr, ShardAllocationState state) {}
}
