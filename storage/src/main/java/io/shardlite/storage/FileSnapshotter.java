// file: storage/src/main/java/io/shardlite/storage/FileSnapshotter.java
package io.shardlite.storage;

import io.shardlite.core.exception.PersistenceFailureException;
import io.shardlite.core.state.ShardAllocationState;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int64 sequenceNr
 *   int32 regionCount,  then each regionId (int32 len + UTF-8 bytes)
 *   int32 shardCount,   then each (shardId, regionId) in allocation order
 *   int32 handOffCount, then each shardId
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<seq>.bin.tmp" first,
 *   - then move to "snapshot-<seq>.bin" using ATOMIC_MOVE.
 *   - Older snapshots are deleted once the new one is in place.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final Logger log = Logger.getLogger(FileSnapshotter.class.getName());
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".bin";

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PersistenceFailureException("cannot create snapshot directory " + dir, e);
        }
    }

    @Override
    public String save(long sequenceNr, ShardAllocationState state) {
        String name = String.format("%s%019d%s", PREFIX, sequenceNr, SUFFIX);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC))) {
            out.writeLong(sequenceNr);
            out.writeInt(state.regions().size());
            for (String regionId : state.regions().keySet()) {
                writeString(out, regionId);
            }
            out.writeInt(state.shards().size());
            for (Map.Entry<String, String> e : state.shards().entrySet()) {
                writeString(out, e.getKey());
                writeString(out, e.getValue());
            }
            out.writeInt(state.handOffInProgress().size());
            for (String shardId : state.handOffInProgress()) {
                writeString(out, shardId);
            }
        } catch (IOException e) {
            throw new PersistenceFailureException("snapshot write to " + tmp + " failed", e);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PersistenceFailureException("snapshot move to " + dst + " failed", e);
        }

        for (Path older : snapshots()) {
            if (!older.equals(dst)) {
                try {
                    Files.deleteIfExists(older);
                } catch (IOException e) {
                    log.warning(() -> "could not delete old snapshot " + older + ": " + e);
                }
            }
        }
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> all = snapshots();
        if (all.isEmpty()) return null;
        Path snap = all.get(all.size() - 1);

        try (var in = new DataInputStream(Files.newInputStream(snap))) {
            long seq = in.readLong();
            int regionCount = in.readInt();
            Set<String> regions = new LinkedHashSet<>();
            for (int i = 0; i < regionCount; i++) {
                regions.add(readString(in));
            }
            int shardCount = in.readInt();
            Map<String, String> shards = new LinkedHashMap<>();
            for (int i = 0; i < shardCount; i++) {
                String shardId = readString(in);
                shards.put(shardId, readString(in));
            }
            int handOffCount = in.readInt();
            Set<String> handOff = new LinkedHashSet<>();
            for (int i = 0; i < handOffCount; i++) {
                handOff.add(readString(in));
            }
            return new LoadedSnapshot(seq, ShardAllocationState.of(regions, shards, handOff));
        } catch (IOException e) {
            throw new PersistenceFailureException("snapshot read from " + snap + " failed", e);
        }
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PersistenceFailureException("cannot list snapshots in " + dir, e);
        }
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    private static String readString(DataInputStream in) throws IOException {
        int len = in.readInt();
        byte[] b = in.readNBytes(len);
        return new String(b, StandardCharsets.UTF_8);
    }
}
