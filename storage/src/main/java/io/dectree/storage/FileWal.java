// file: storage/src/main/java/io/dectree/storage/FileWal.java
package io.dectree.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files
 * ("00000001.log", "00000002.log", ...).
 * <p>
 *  - On construction it creates the directory if needed, opens the newest
 *    segment for append and cuts off a torn tail left by a crash, so records
 *    appended afterwards stay readable.
 *  - append() writes the bytes and calls force(true).
 *  - rotateIfNeeded() starts the next segment once the current one holds at
 *    least rotateBytes.
 *  - The reader walks every segment in name order and stops at the first
 *    truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());
    static final String FIRST_SEGMENT = "00000001.log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new RuntimeException(e); }
        openNewestOrCreate();
    }

    @Override
    public void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new RuntimeException("WAL append failed", e);
        }
    }

    @Override
    public void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            String next = String.format("%08d.log", Integer.parseInt(
                    current.getFileName().toString().replace(".log", "")) + 1);
            current = dir.resolve(next);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) { throw new RuntimeException(e); }
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public void close() throws IOException { if (ch != null) ch.close(); }

    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments(dir);
            current = segs.isEmpty() ? dir.resolve(FIRST_SEGMENT) : segs.get(segs.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long size = ch.size();
            long valid = validLength(ch);
            if (valid < size) {
                log.log(Level.WARNING, "truncating torn tail of " + current.getFileName()
                        + " from " + size + " to " + valid + " bytes");
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) { throw new RuntimeException(e); }
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .toList();
        } catch (IOException e) { throw new RuntimeException(e); }
    }

    /** Byte length of the prefix of a segment made of complete, CRC-valid records. */
    private static long validLength(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            byte[] payload = readRecord(ch, pos);
            if (payload == null) return pos;
            pos += RecordCodec.HEADER_BYTES + payload.length;
        }
    }

    /** Payload of the record starting at {@code pos}, or null if there is none or it is damaged. */
    private static byte[] readRecord(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        while (hdr.hasRemaining()) {
            int n = ch.read(hdr, pos + hdr.position());
            if (n <= 0) break;
        }
        if (hdr.hasRemaining()) return null; // EOF or truncated header
        hdr.flip();
        int len = RecordCodec.payloadLength(hdr);
        int crc = hdr.getInt();
        if (len < 0 || pos + RecordCodec.HEADER_BYTES + len > ch.size()) return null;
        ByteBuffer payload = ByteBuffer.allocate(len);
        while (payload.hasRemaining()) {
            int n = ch.read(payload, pos + RecordCodec.HEADER_BYTES + payload.position());
            if (n <= 0) return null;
        }
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != crc) return null;
        return bytes;
    }

    /** Sequential reader over all segments, used during recovery. */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segment = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean done;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            try {
                while (!done) {
                    if (ch == null && !openNext()) {
                        done = true;
                        break;
                    }
                    byte[] bytes = readRecord(ch, pos);
                    if (bytes != null) {
                        pos += RecordCodec.HEADER_BYTES + bytes.length;
                        return bytes;
                    }
                    if (pos < ch.size()) {
                        // damaged record: nothing after it can be trusted
                        done = true;
                        break;
                    }
                    ch.close();
                    ch = null;
                }
                return null;
            } catch (IOException e) {
                throw new RuntimeException(e);
            }
        }

        private boolean openNext() throws IOException {
            segment++;
            if (segment >= segments.size()) return false;
            ch = FileChannel.open(segments.get(segment), READ);
            pos = 0;
            return true;
        }

        @Override
        public void close() throws IOException {
            if (ch != null) ch.close();
        }
    }
}
