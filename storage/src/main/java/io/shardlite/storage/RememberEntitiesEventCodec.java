// file: storage/src/main/java/io/shardlite/storage/RememberEntitiesEventCodec.java
package io.shardlite.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Format: 1-byte tag (1 = started, 2 = stopped), int32 count, then each
 * entity id as int32 length + UTF-8 bytes (sorted, so encoding is stable).
 */
public final class RememberEntitiesEventCodec implements EventCodec<RememberEntitiesEvent> {

    private static final byte STARTED = 1;
    private static final byte STOPPED = 2;

    @Override
    public byte[] encode(RememberEntitiesEvent event) {
        byte tag = event instanceof RememberEntitiesEvent.EntitiesStarted ? STARTED : STOPPED;
        Set<String> ids = new TreeSet<>(event.entityIds());
        int size = 1 + 4;
        for (String id : ids) {
            size += RecordCodec.sizeOf(id);
        }
        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.put(tag).putInt(ids.size());
        for (String id : ids) {
            RecordCodec.writeString(b, id);
        }
        return b.array();
    }

    @Override
    public RememberEntitiesEvent decode(byte[] bytes) {
        ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        byte tag = b.get();
        int count = b.getInt();
        Set<String> ids = new LinkedHashSet<>();
        for (int i = 0; i < count; i++) {
            ids.add(RecordCodec.readString(b));
        }
        switch (tag) {
            case STARTED:
                return new RememberEntitiesEvent.EntitiesStarted(ids);
            case STOPPED:
                return new RememberEntitiesEvent.EntitiesStopped(ids);
            default:
                throw new IllegalArgumentException("unknown remember-entities event tag " + tag);
        }
    }
}
