// file: storage/src/main/java/io/shardlite/storage/RecordCodec.java
package io.shardlite.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for journal records.
 * <p>
 * On-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x5A4D
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - sequenceNr: int64
 *     - event:      remaining bytes, as produced by an {@link EventCodec}
 */
final class RecordCodec {
    static final short MAGIC = (short) 0x5A4D;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private RecordCodec() {
    }

    /** Decoded journal record. */
    record LogRecord(long sequenceNr, byte[] event) {
    }

    /** Frame one record into header+payload bytes ready for {@link Wal#append}. */
    static byte[] frame(long sequenceNr, byte[] event) {
        ByteBuffer payload = ByteBuffer.allocate(8 + event.length).order(ByteOrder.LITTLE_ENDIAN);
        payload.putLong(sequenceNr).put(event);
        byte[] p = payload.array();

        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + p.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(p.length).putInt(crc32(p)).put(p);
        return out.array();
    }

    /** Decode a payload returned by {@link Wal.WalReader#next()}. */
    static LogRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        long seq = b.getLong();
        byte[] event = new byte[b.remaining()];
        b.get(event);
        return new LogRecord(seq, event);
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    // ----------------- helpers shared by event codecs -----------------

    static int sizeOf(String s) {
        return 4 + s.getBytes(StandardCharsets.UTF_8).length;
    }

    static void writeString(ByteBuffer b, String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        b.putInt(bytes.length).put(bytes);
    }

    static String readString(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("corrupt string length " + len);
        }
        byte[] out = new byte[len];
        b.get(out);
        return new String(out, StandardCharsets.UTF_8);
    }
}
