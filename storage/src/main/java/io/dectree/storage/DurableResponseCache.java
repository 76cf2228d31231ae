// file: storage/src/main/java/io/dectree/storage/DurableResponseCache.java
package io.dectree.storage;

import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * WAL-backed {@link ResponseCache}.
 * <p>
 *  - store():
 *      1) encode the entry as a log record,
 *      2) append + fsync,
 *      3) put it into the in-memory map,
 *      4) rotate the segment if needed.
 *  - On construction the log is replayed oldest first; a later record for the
 *    same key replaces an earlier one.
 * <p>
 * Every operation holds the instance monitor, so concurrent callers see stores
 * in a single total order and a lookup never observes a half-applied store.
 */
public class DurableResponseCache implements ResponseCache, AutoCloseable {
    private static final Logger log = Logger.getLogger(DurableResponseCache.class.getName());

    /** Segment size for {@link #open(Path)}. */
    public static final long DEFAULT_ROTATE_BYTES = 8L << 20;

    private final Map<String, CacheEntry> mem = new HashMap<>();
    private final Wal wal;
    private final Clock clock;

    public DurableResponseCache(Wal wal, Clock clock) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.clock = Objects.requireNonNull(clock, "clock");
        recover();
    }

    /** Open (or create) a cache whose log lives in {@code dir}. */
    public static DurableResponseCache open(Path dir) {
        return new DurableResponseCache(new FileWal(dir, DEFAULT_ROTATE_BYTES), Clock.systemUTC());
    }

    @Override
    public synchronized Optional<String> lookup(String action, String prompt) {
        return entry(action, prompt).map(CacheEntry::content);
    }

    @Override
    public synchronized Optional<CacheEntry> entry(String action, String prompt) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(prompt, "prompt");
        String key = CacheKey.of(action, prompt);
        CacheEntry hit = mem.get(key);
        log.log(Level.FINE, (hit == null ? "cache miss " : "cache hit ") + key);
        return Optional.ofNullable(hit);
    }

    @Override
    public synchronized void store(String action, String prompt, String content) {
        var entry = new CacheEntry(CacheKey.of(action, prompt), action, prompt, content, clock.instant());

        // fsync before the entry becomes visible
        wal.append(RecordCodec.encode(entry));
        mem.put(entry.key(), entry);

        wal.rotateIfNeeded();
    }

    @Override
    public synchronized int size() {
        return mem.size();
    }

    @Override
    public synchronized void close() throws Exception {
        wal.close();
    }

    private void recover() {
        int records = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                CacheEntry e = RecordCodec.decode(payload);
                mem.put(e.key(), e);
                records++;
            }
        } catch (Exception e) {
            throw new RuntimeException("cache recovery failed", e);
        }
        log.log(Level.INFO, "response cache recovered " + mem.size() + " entries from " + records + " log records");
    }
}
