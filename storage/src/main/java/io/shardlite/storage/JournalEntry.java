// file: storage/src/main/java/io/shardlite/storage/JournalEntry.java
package io.shardlite.storage;

/**
 * One replayed journal event with its sequence number (starting at 1).
 */
public record JournalEntry<E>(long sequenceNr, E event) {
}
