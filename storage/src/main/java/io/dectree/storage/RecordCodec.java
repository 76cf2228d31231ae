// file: storage/src/main/java/io/dectree/storage/RecordCodec.java
package io.dectree.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.zip.CRC32;

/**
 * Binary framing for cache log records.
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xDEC7
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - key:       int32 len + UTF-8 bytes
 *     - action:    int32 len + UTF-8 bytes
 *     - prompt:    int32 len + UTF-8 bytes
 *     - content:   int32 len + UTF-8 bytes
 *     - createdAt: int64 epoch seconds + int32 nanos
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xDEC7;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private RecordCodec() {
    }

    /** Encode a cache entry into header+payload bytes ready for append. */
    static byte[] encode(CacheEntry entry) {
        byte[] payload = encodePayload(entry);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static CacheEntry decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        String key = readString(b);
        String action = readString(b);
        String prompt = readString(b);
        String content = readString(b);
        long seconds = b.getLong();
        int nanos = b.getInt();
        return new CacheEntry(key, action, prompt, content, Instant.ofEpochSecond(seconds, nanos));
    }

    /**
     * Payload length declared by a header, or -1 if the bytes are not a record
     * header. Leaves the buffer positioned at the crc field.
     */
    static int payloadLength(ByteBuffer header) {
        short magic = header.getShort();
        byte ver = header.get();
        int len = header.getInt();
        if (magic != MAGIC || ver != VERSION || len < 0) return -1;
        return len;
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(CacheEntry e) {
        byte[] key = e.key().getBytes(StandardCharsets.UTF_8);
        byte[] action = e.action().getBytes(StandardCharsets.UTF_8);
        byte[] prompt = e.prompt().getBytes(StandardCharsets.UTF_8);
        byte[] content = e.content().getBytes(StandardCharsets.UTF_8);

        int size = 4 + key.length
                + 4 + action.length
                + 4 + prompt.length
                + 4 + content.length
                + 8 + 4;
        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        writeBytes(b, key);
        writeBytes(b, action);
        writeBytes(b, prompt);
        writeBytes(b, content);
        b.putLong(e.createdAt().getEpochSecond());
        b.putInt(e.createdAt().getNano());
        return b.array();
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        b.putInt(data.length).put(data);
    }

    private static String readString(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalStateException("corrupt cache record: field length " + len);
        }
        byte[] out = new byte[len];
        b.get(out);
        return new String(out, StandardCharsets.UTF_8);
    }
}
