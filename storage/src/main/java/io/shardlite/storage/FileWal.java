// file: storage/src/main/java/io/shardlite/storage/FileWal.java
package io.shardlite.storage;

import io.shardlite.core.exception.PersistenceFailureException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * File-backed WAL writing framed records to numbered segment files
 * ("00000001.log", "00000002.log", ...).
 * <p>
 *  - On construction: creates the directory, opens the newest segment, cuts
 *    off a torn tail left by a crash, and positions at its end (or creates the
 *    first segment).
 *  - append(): write, force(true), count bytes in the segment.
 *  - rotateIfNeeded(): once the segment reached rotateBytes, open the next one.
 *  - Reader: walks every segment in name order; within a segment it stops at
 *    the first truncated header/payload or CRC mismatch, and a bad record ends
 *    the whole log (later segments are not trusted past a torn write).
 */
public final class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PersistenceFailureException("cannot create WAL directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] framedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(framedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += framedRecord.length;
        } catch (IOException e) {
            throw new PersistenceFailureException("WAL append to " + current + " failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            int index = Integer.parseInt(current.getFileName().toString().replace(SUFFIX, ""));
            current = dir.resolve(segmentName(index + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new PersistenceFailureException("WAL rotation in " + dir + " failed", e);
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments(dir));
    }

    @Override
    public synchronized void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void openNewestOrCreate() {
        List<Path> segs = segments(dir);
        current = segs.isEmpty() ? dir.resolve(segmentName(1)) : segs.get(segs.size() - 1);
        try {
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validLength(ch);
            if (valid < ch.size()) {
                log.warning(() -> "truncating torn tail of " + current + " at byte " + valid);
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new PersistenceFailureException("cannot open WAL segment " + current, e);
        }
    }

    /** Length of the prefix of the segment made of complete, CRC-valid records. */
    private static long validLength(FileChannel ch) throws IOException {
        long pos = 0;
        long size = ch.size();
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        while (pos + RecordCodec.HEADER_BYTES <= size) {
            hdr.clear();
            ch.read(hdr, pos);
            hdr.flip();
            short magic = hdr.getShort();
            byte ver = hdr.get();
            int len = hdr.getInt();
            int crc = hdr.getInt();
            if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) break;
            if (pos + RecordCodec.HEADER_BYTES + len > size) break;
            ByteBuffer payload = ByteBuffer.allocate(len);
            ch.read(payload, pos + RecordCodec.HEADER_BYTES);
            if (RecordCodec.crc32(payload.array()) != crc) break;
            pos += RecordCodec.HEADER_BYTES + len;
        }
        return pos;
    }

    private static String segmentName(int index) {
        return String.format("%08d%s", index, SUFFIX);
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PersistenceFailureException("cannot list WAL segments in " + dir, e);
        }
    }

    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segmentIndex = -1;
        private FileChannel ch;
        private long pos;
        private boolean corrupt;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (corrupt) return null;
            try {
                while (true) {
                    if (ch == null && !openNextSegment()) {
                        return null;
                    }
                    ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
                    int read = ch.read(hdr, pos);
                    if (read <= 0) {
                        // clean end of this segment
                        ch.close();
                        ch = null;
                        continue;
                    }
                    if (read < RecordCodec.HEADER_BYTES) return stop();
                    hdr.flip();
                    short magic = hdr.getShort();
                    byte ver = hdr.get();
                    int len = hdr.getInt();
                    int crc = hdr.getInt();
                    if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return stop();
                    ByteBuffer payload = ByteBuffer.allocate(len);
                    int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
                    if (r2 < len) return stop();
                    byte[] bytes = payload.array();
                    if (RecordCodec.crc32(bytes) != crc) return stop();
                    pos += RecordCodec.HEADER_BYTES + len;
                    return bytes;
                }
            } catch (IOException e) {
                throw new PersistenceFailureException("WAL read failed", e);
            }
        }

        private boolean openNextSegment() throws IOException {
            segmentIndex++;
            if (segmentIndex >= segments.size()) return false;
            ch = FileChannel.open(segments.get(segmentIndex), READ);
            pos = 0;
            return true;
        }

        private byte[] stop() {
            corrupt = true;
            return null;
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
