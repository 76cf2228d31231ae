// file: storage/src/main/java/io/dectree/storage/CacheKey.java
package io.dectree.storage;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic cache fingerprint:
 * <pre>
 *   hex(SHA-256(utf8(action) || 0x00 || utf8(prompt)))
 * </pre>
 * The zero byte keeps ("ab", "c") and ("a", "bc") apart. The prompt is hashed
 * exactly as given: no trimming, no case folding.
 */
public final class CacheKey {
    public static final int HEX_LENGTH = 64;

    private CacheKey() {
    }

    public static String of(String action, String prompt) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(action.getBytes(StandardCharsets.UTF_8));
            md.update((byte) 0);
            md.update(prompt.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(md.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
