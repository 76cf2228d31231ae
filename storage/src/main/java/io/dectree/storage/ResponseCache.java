// file: storage/src/main/java/io/dectree/storage/ResponseCache.java
package io.dectree.storage;

import java.util.Optional;

/**
 * Content-addressed store for generated analyses.
 * <p>
 * Entries are keyed by {@link CacheKey#of(String, String)}; a second store
 * under the same (action, prompt) overwrites the first. Entries never expire.
 * Implementations must be safe for concurrent use.
 */
public interface ResponseCache {

    /** Cached content for exactly this action and prompt, if any. */
    Optional<String> lookup(String action, String prompt);

    /** Insert or overwrite. */
    void store(String action, String prompt, String content);

    /** Full entry including the stored prompt and creation time. */
    Optional<CacheEntry> entry(String action, String prompt);

    int size();
}
