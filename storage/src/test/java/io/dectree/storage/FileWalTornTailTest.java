// file: storage/src/test/java/io/dectree/storage/FileWalTornTailTest.java
package io.dectree.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path walDir;

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private static CacheEntry entry(String action, String prompt, String content) {
        return new CacheEntry(CacheKey.of(action, prompt), action, prompt, content, CLOCK.instant());
    }

    private void writeTornLog() throws Exception {
        var wal = new FileWal(walDir, 1L << 60); // huge rotate threshold so single segment
        wal.append(RecordCodec.encode(entry("comment", "p1", "v1")));
        wal.append(RecordCodec.encode(entry("comment", "p2", "v2")));
        byte[] r3 = RecordCodec.encode(entry("comment", "p3", "v3"));
        wal.close();

        // header says "len" but the payload is short, as after a crash mid-write
        Path seg = walDir.resolve(FileWal.FIRST_SEGMENT);
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(r3, 0, r3.length - 5);
        }
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_records() throws Exception {
        writeTornLog();

        try (var cache = new DurableResponseCache(new FileWal(walDir, 1L << 60), CLOCK)) {
            assertEquals(Optional.of("v1"), cache.lookup("comment", "p1"));
            assertEquals(Optional.of("v2"), cache.lookup("comment", "p2"));
            assertTrue(cache.lookup("comment", "p3").isEmpty());
        }
    }

    @Test
    void appends_after_a_torn_tail_are_recovered() throws Exception {
        writeTornLog();

        try (var cache = new DurableResponseCache(new FileWal(walDir, 1L << 60), CLOCK)) {
            cache.store("comment", "p4", "v4");
        }
        try (var cache = new DurableResponseCache(new FileWal(walDir, 1L << 60), CLOCK)) {
            assertEquals(3, cache.size());
            assertEquals(Optional.of("v4"), cache.lookup("comment", "p4"));
        }
    }

    @Test
    void corrupted_crc_stops_replay() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(RecordCodec.encode(entry("comment", "p1", "v1")));
        byte[] bad = RecordCodec.encode(entry("comment", "p2", "v2"));
        bad[bad.length - 1] ^= 0x7F;
        wal.append(bad);
        wal.append(RecordCodec.encode(entry("comment", "p3", "v3")));
        wal.close();

        try (var reopened = new FileWal(walDir, 1L << 60);
             Wal.WalReader r = reopened.openReader()) {
            assertNotNull(r.next());
            assertNull(r.next());
        }
    }
}
