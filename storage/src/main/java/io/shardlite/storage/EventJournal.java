// file: storage/src/main/java/io/shardlite/storage/EventJournal.java
package io.shardlite.storage;

import java.util.List;

/**
 * Append-only durable event log.
 * <p>
 * Semantics:
 *  - append() is durable before it returns and assigns the next sequence
 *    number; a failed append throws
 *    {@link io.shardlite.core.exception.PersistenceFailureException} and the
 *    event must be considered not written.
 *  - replayFrom(n) returns every event with sequenceNr >= n, in order.
 */
public interface EventJournal<E> extends AutoCloseable {

    /**
     * @return the sequence number assigned to the event
     */
    long append(E event);

    List<JournalEntry<E>> replayFrom(long fromSequenceNr);

    /** @return highest sequence number written so far, 0 for an empty journal. */
    long highestSequenceNr();

    @Override
    void close();
}
