// file: storage/src/main/java/io/dectree/storage/Wal.java
package io.dectree.storage;

import java.io.IOException;

/**
 * Append-only log behind {@link DurableResponseCache}. Each record is one
 * framed {@link CacheEntry} (see {@link RecordCodec}); replaying the log in
 * order and letting later entries replace earlier ones for the same key
 * rebuilds the cache.
 * <p>
 * A store is acknowledged only after its record is on disk, so a cache entry
 * returned by lookup before a crash is still there after restart. A record cut
 * short by a crash counts as never written.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append one framed cache record and fsync it.
     *
     * @param serializedRecord header and payload, as produced by {@code RecordCodec.encode}
     */
    void append(byte[] serializedRecord);

    /** Start a new segment once the active one has passed its size limit. */
    void rotateIfNeeded();

    /**
     * Cache records from every segment, oldest first. Iteration ends at the
     * first record whose header, length or checksum does not hold.
     */
    WalReader openReader();

    @Override
    void close() throws IOException;

    /** Sequential access to cache record payloads during replay. */
    interface WalReader extends AutoCloseable {

        /** @return the next payload without its header, or null when replay is done */
        byte[] next();
    }
}
