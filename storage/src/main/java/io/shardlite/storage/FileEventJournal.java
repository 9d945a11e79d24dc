// file: storage/src/main/java/io/shardlite/storage/FileEventJournal.java
package io.shardlite.storage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link EventJournal} over a {@link FileWal}.
 * <p>
 * On open, the whole log is scanned once to recover the highest sequence
 * number; appends then continue from there.
 */
public final class FileEventJournal<E> implements EventJournal<E> {

    private static final long DEFAULT_ROTATE_BYTES = 64L * 1024 * 1024;

    private final Wal wal;
    private final EventCodec<E> codec;
    private long highestSequenceNr;

    public FileEventJournal(Path dir, EventCodec<E> codec) {
        this(new FileWal(dir, DEFAULT_ROTATE_BYTES), codec);
    }

    public FileEventJournal(Wal wal, EventCodec<E> codec) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.codec = Objects.requireNonNull(codec, "codec");
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                highestSequenceNr = Math.max(highestSequenceNr, RecordCodec.decode(payload).sequenceNr());
            }
        }
    }

    @Override
    public synchronized long append(E event) {
        long seq = highestSequenceNr + 1;
        wal.append(RecordCodec.frame(seq, codec.encode(event)));
        highestSequenceNr = seq;
        wal.rotateIfNeeded();
        return seq;
    }

    @Override
    public synchronized List<JournalEntry<E>> replayFrom(long fromSequenceNr) {
        List<JournalEntry<E>> out = new ArrayList<>();
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                if (rec.sequenceNr() >= fromSequenceNr) {
                    out.add(new JournalEntry<>(rec.sequenceNr(), codec.decode(rec.event())));
                }
            }
        }
        return out;
    }

    @Override
    public synchronized long highestSequenceNr() {
        return highestSequenceNr;
    }

    @Override
    public void close() {
        wal.close();
    }
}
