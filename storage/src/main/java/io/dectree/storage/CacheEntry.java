// file: storage/src/main/java/io/dectree/storage/CacheEntry.java
package io.dectree.storage;

import java.time.Instant;
import java.util.Objects;

/**
 * One cached generation result.
 *
 * @param key     64 hex chars, see {@link CacheKey}
 * @param action  action name the content was generated for
 * @param prompt  exact prompt text that was sent
 * @param content generated text
 */
public record CacheEntry(String key, String action, String prompt, String content, Instant createdAt) {
    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
