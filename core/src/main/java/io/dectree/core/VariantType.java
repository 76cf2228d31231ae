// file: core/src/main/java/io/dectree/core/VariantType.java
package io.dectree.core;

import java.util.Locale;

/**
 * Kind of text attached to a node besides its primary body.
 * <p>
 *  - TRANSLATION: authoritative rendering in another language (ingested).
 *  - ALTERNATIVE: user-proposed rewrite, carries editor/tag metadata.
 */
public enum VariantType {
    TRANSLATION("translation"),
    ALTERNATIVE("alternative");

    private final String wireName;

    VariantType(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in persisted rows. */
    public String wireName() {
        return wireName;
    }

    /**
     * Parse a persisted variant label. Missing labels are treated as translations,
     * matching rows written before alternatives existed.
     */
    public static VariantType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return TRANSLATION;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (VariantType t : values()) {
            if (t.wireName.equals(v)) {
                return t;
            }
        }
        throw new IllegalArgumentException("unknown variant type: " + value);
    }
}
