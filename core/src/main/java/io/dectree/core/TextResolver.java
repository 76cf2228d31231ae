// file: core/src/main/java/io/dectree/core/TextResolver.java
package io.dectree.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Picks the text of a node for a requested language.
 * <p>
 *  - blank code, or a code starting with the original language: node text.
 *  - otherwise: the first translation (insertion order, alternatives excluded)
 *    whose lang starts with the code's 2-letter prefix, e.g. "en" matches
 *    "en", "en-ogden" and "en-pmc"; falls back to the node text.
 */
public final class TextResolver {
    public static final String DEFAULT_ORIGINAL_LANGUAGE = "de";

    private final String originalLanguage;

    public TextResolver() {
        this(DEFAULT_ORIGINAL_LANGUAGE);
    }

    public TextResolver(String originalLanguage) {
        this.originalLanguage = Objects.requireNonNull(originalLanguage, "originalLanguage").toLowerCase(Locale.ROOT);
    }

    public String originalLanguage() {
        return originalLanguage;
    }

    public String resolve(Node node, String languageCode) {
        Objects.requireNonNull(node, "node");
        if (languageCode == null || languageCode.isBlank()) {
            return node.text();
        }
        String code = languageCode.trim().toLowerCase(Locale.ROOT);
        if (code.startsWith(originalLanguage)) {
            return node.text();
        }
        String prefix = shortCode(code);
        for (Translation t : node.translations()) {
            if (!t.isAlternative() && t.lang().toLowerCase(Locale.ROOT).startsWith(prefix)) {
                return t.text();
            }
        }
        return node.text();
    }

    /** First two letters of a language code, lowercased ("en-ogden" gives "en"). */
    public static String shortCode(String languageCode) {
        String code = languageCode.trim().toLowerCase(Locale.ROOT);
        return code.length() <= 2 ? code : code.substring(0, 2);
    }
}
