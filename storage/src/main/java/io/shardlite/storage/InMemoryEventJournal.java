// file: storage/src/main/java/io/shardlite/storage/InMemoryEventJournal.java
package io.shardlite.storage;

import java.util.ArrayList;
import java.util.List;

/**
 * Non-durable {@link EventJournal} for tests and single-process demos.
 * Survives a coordinator restart as long as the same instance is reused.
 */
public class InMemoryEventJournal<E> implements EventJournal<E> {

    private final List<E> events = new ArrayList<>();

    @Override
    public synchronized long append(E event) {
        events.add(event);
        return events.size();
    }

    @Override
    public synchronized List<JournalEntry<E>> replayFrom(long fromSequenceNr) {
        List<JournalEntry<E>> out = new ArrayList<>();
        for (int i = (int) Math.max(0, fromSequenceNr - 1); i < events.size(); i++) {
            out.add(new JournalEntry<>(i + 1, events.get(i)));
        }
        return out;
    }

    @Override
    public synchronized long highestSequenceNr() {
        return events.size();
    }

    @Override
    public void close() {
    }
}
