// file: storage/src/test/java/io/shardlite/storage/FileEventJournalTest.java
package io.shardlite.storage;

import io.shardlite.core.state.CoordinatorEvent;
import io.shardlite.core.state.ShardAllocationState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileEventJournalTest {

    @TempDir Path dir;

    private final CoordinatorEventCodec codec = new CoordinatorEventCodec();

    @Test
    void events_survive_restart_in_order_and_rebuild_the_same_state() {
        List<CoordinatorEvent> events = List.of(
                new CoordinatorEvent.RegionRegistered("r1"),
                new CoordinatorEvent.RegionRegistered("r2"),
                new CoordinatorEvent.ShardHomeAllocated("7", "r1"),
                new CoordinatorEvent.ShardHomeAllocated("8", "r1"),
                new CoordinatorEvent.ShardHandOffStarted("7"),
                new CoordinatorEvent.ShardHomeDeallocated("7"),
                new CoordinatorEvent.ShardHomeAllocated("7", "r2"));

        ShardAllocationState expected = ShardAllocationState.empty();
        try (var journal = new FileEventJournal<>(dir, codec)) {
            for (CoordinatorEvent e : events) {
                journal.append(e);
                expected = expected.updated(e);
            }
        }

        // "Crash": new instance recovers from disk
        try (var journal = new FileEventJournal<>(dir, codec)) {
            assertEquals(events.size(), journal.highestSequenceNr());
            ShardAllocationState rebuilt = ShardAllocationState.empty();
            for (JournalEntry<CoordinatorEvent> e : journal.replayFrom(1)) {
                rebuilt = rebuilt.updated(e.event());
            }
            assertEquals(expected, rebuilt);
            assertEquals("r2", rebuilt.ownerOf("7"));
        }
    }

    @Test
    void replay_from_skips_earlier_sequence_numbers() {
        try (var journal = new FileEventJournal<>(dir, codec)) {
            journal.append(new CoordinatorEvent.RegionRegistered("r1"));
            journal.append(new CoordinatorEvent.RegionRegistered("r2"));
            journal.append(new CoordinatorEvent.RegionRegistered("r3"));

            List<JournalEntry<CoordinatorEvent>> tail = journal.replayFrom(3);
            assertEquals(1, tail.size());
            assertEquals(3, tail.get(0).sequenceNr());
            assertEquals(new CoordinatorEvent.RegionRegistered("r3"), tail.get(0).event());
        }
    }

    @Test
    void rotation_keeps_sequence_numbers_across_segments() throws Exception {
        try (var journal = new FileEventJournal<>(new FileWal(dir, 64), codec)) {
            for (int i = 0; i < 10; i++) {
                journal.append(new CoordinatorEvent.RegionRegistered("region-" + i));
            }
        }
        try (var files = Files.list(dir)) {
            assertTrue(files.count() > 1, "expected several segments");
        }
        try (var journal = new FileEventJournal<>(new FileWal(dir, 64), codec)) {
            assertEquals(10, journal.highestSequenceNr());
            assertEquals(11, journal.append(new CoordinatorEvent.RegionRegistered("late")));
            assertEquals(11, journal.replayFrom(1).size());
        }
    }
}
