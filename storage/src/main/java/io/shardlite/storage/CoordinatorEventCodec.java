// file: storage/src/main/java/io/shardlite/storage/CoordinatorEventCodec.java
package io.shardlite.storage;

import io.shardlite.core.state.CoordinatorEvent;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Binary codec for {@link CoordinatorEvent}.
 * <p>
 * Format: a 1-byte type tag followed by the event's string fields, each
 * written as int32 length + UTF-8 bytes.
 */
public final class CoordinatorEventCodec implements EventCodec<CoordinatorEvent> {

    private static final byte REGION_REGISTERED = 1;
    private static final byte REGION_TERMINATED = 2;
    private static final byte SHARD_HOME_ALLOCATED = 3;
    private static final byte SHARD_HOME_DEALLOCATED = 4;
    private static final byte SHARD_HANDOFF_STARTED = 5;

    @Override
    public byte[] encode(CoordinatorEvent event) {
        if (event instanceof CoordinatorEvent.RegionRegistered e) {
            return tagged(REGION_REGISTERED, e.regionId());
        }
        if (event instanceof CoordinatorEvent.RegionTerminated e) {
            return tagged(REGION_TERMINATED, e.regionId());
        }
        if (event instanceof CoordinatorEvent.ShardHomeAllocated e) {
            return tagged(SHARD_HOME_ALLOCATED, e.shardId(), e.regionId());
        }
        if (event instanceof CoordinatorEvent.ShardHomeDeallocated e) {
            return tagged(SHARD_HOME_DEALLOCATED, e.shardId());
        }
        if (event instanceof CoordinatorEvent.ShardHandOffStarted e) {
            return tagged(SHARD_HANDOFF_STARTED, e.shardId());
        }
        throw new IllegalArgumentException("unknown event type: " + event.getClass().getName());
    }

    @Override
    public CoordinatorEvent decode(byte[] bytes) {
        ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        byte tag = b.get();
        switch (tag) {
            case REGION_REGISTERED:
                return new CoordinatorEvent.RegionRegistered(RecordCodec.readString(b));
            case REGION_TERMINATED:
                return new CoordinatorEvent.RegionTerminated(RecordCodec.readString(b));
            case SHARD_HOME_ALLOCATED:
                return new CoordinatorEvent.ShardHomeAllocated(RecordCodec.readString(b), RecordCodec.readString(b));
            case SHARD_HOME_DEALLOCATED:
                return new CoordinatorEvent.ShardHomeDeallocated(RecordCodec.readString(b));
            case SHARD_HANDOFF_STARTED:
                return new CoordinatorEvent.ShardHandOffStarted(RecordCodec.readString(b));
            default:
                throw new IllegalArgumentException("unknown coordinator event tag " + tag);
        }
    }

    private static byte[] tagged(byte tag, String... fields) {
        int size = 1;
        for (String f : fields) {
            size += RecordCodec.sizeOf(f);
        }
        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.put(tag);
        for (String f : fields) {
            RecordCodec.writeString(b, f);
        }
        return b.array();
    }
}
