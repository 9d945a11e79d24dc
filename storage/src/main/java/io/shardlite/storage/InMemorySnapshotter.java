// file: storage/src/main/java/io/shardlite/storage/InMemorySnapshotter.java
package io.shardlite.storage;

import io.shardlite.core.state.ShardAllocationState;

/** Keeps only the latest snapshot, in memory. */
public class InMemorySnapshotter implements Snapshotter {

    private volatile LoadedSnapshot latest;

    @Override
    public String save(long sequenceNr, ShardAllocationState state) {
        latest = new LoadedSnapshot(sequenceNr, state);
        return "memory-" + sequenceNr;
    }

    @Override
    public LoadedSnapshot loadLatest() {
        return latest;
    }
}
