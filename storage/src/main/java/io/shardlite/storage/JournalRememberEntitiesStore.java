// file: storage/src/main/java/io/shardlite/storage/JournalRememberEntitiesStore.java
package io.shardlite.storage;

import io.shardlite.core.exception.PersistenceFailureException;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * {@link RememberEntitiesStore} keeping one {@link FileEventJournal} per shard
 * under {@code baseDir/<shardId>/}.
 * <p>
 * Design:
 *  - An update appends EntitiesStarted and/or EntitiesStopped; load() replays.
 *  - Journals are opened lazily and kept open until close().
 */
public final class JournalRememberEntitiesStore implements RememberEntitiesStore {
    private static final Logger log = Logger.getLogger(JournalRememberEntitiesStore.class.getName());
    private static final Pattern SAFE_DIR = Pattern.compile("[A-Za-z0-9._-]+");
    private static final long ROTATE_BYTES = 8L * 1024 * 1024;

    private final Path baseDir;
    private final RememberEntitiesEventCodec codec = new RememberEntitiesEventCodec();
    private final Map<String, FileEventJournal<RememberEntitiesEvent>> journals = new ConcurrentHashMap<>();

    public JournalRememberEntitiesStore(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
    }

    @Override
    public Set<String> load(String shardId) {
        FileEventJournal<RememberEntitiesEvent> journal = journal(shardId);
        Set<String> ids = new HashSet<>();
        for (JournalEntry<RememberEntitiesEvent> e : journal.replayFrom(1)) {
            if (e.event() instanceof RememberEntitiesEvent.EntitiesStarted) {
                ids.addAll(e.event().entityIds());
            } else {
                ids.removeAll(e.event().entityIds());
            }
        }
        log.fine(() -> "shard " + shardId + " remembers " + ids.size() + " entities");
        return ids;
    }

    @Override
    public void update(String shardId, Set<String> started, Set<String> stopped) {
        FileEventJournal<RememberEntitiesEvent> journal = journal(shardId);
        if (!started.isEmpty()) {
            journal.append(new RememberEntitiesEvent.EntitiesStarted(started));
        }
        if (!stopped.isEmpty()) {
            journal.append(new RememberEntitiesEvent.EntitiesStopped(stopped));
        }
    }

    @Override
    public void close() {
        journals.values().forEach(FileEventJournal::close);
        journals.clear();
    }

    private FileEventJournal<RememberEntitiesEvent> journal(String shardId) {
        Objects.requireNonNull(shardId, "shardId");
        return journals.computeIfAbsent(shardId, id -> {
            try {
                return new FileEventJournal<>(new FileWal(baseDir.resolve(dirName(id)), ROTATE_BYTES), codec);
            } catch (PersistenceFailureException e) {
                log.severe(() -> "cannot open remember-entities journal for shard " + id + ": " + e);
                throw e;
            }
        });
    }

    /** Shard ids are opaque; anything outside a safe file-name alphabet is hex-encoded. */
    static String dirName(String shardId) {
        if (SAFE_DIR.matcher(shardId).matches() && !shardId.startsWith(".")) {
            return shardId;
        }
        StringBuilder sb = new StringBuilder("x-");
        for (byte b : shardId.getBytes(java.nio.charset.StandardCharsets.UTF_8)) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
