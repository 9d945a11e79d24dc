// file: storage/src/main/java/io/shardlite/storage/Wal.java
package io.shardlite.storage;

/**
 * Write-ahead log of framed records, the durable medium under every journal.
 * <p>
 * Contract:
 *  - append() is atomic at record granularity: a partially written record is
 *    treated as absent during recovery (the reader stops at the first corrupt
 *    or truncated record).
 *  - append() forces the record to disk before returning, so a record whose
 *    append() returned survives a crash.
 *  - Failures surface as {@link io.shardlite.core.exception.PersistenceFailureException}.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single framed record (see {@link RecordCodec#frame}) and fsync it.
     */
    void append(byte[] framedRecord);

    /**
     * Start a new segment when the current one reached its size threshold.
     * Called by the journal after each append.
     */
    void rotateIfNeeded();

    /**
     * Open a sequential reader over all segments, oldest first.
     */
    WalReader openReader();

    /**
     * Reader used during recovery.
     */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (without header), or null at the end of the
         *         log or at the first corrupt/truncated record.
         */
        byte[] next();

        @Override
        void close();
    }

    @Override
    void close();
}
