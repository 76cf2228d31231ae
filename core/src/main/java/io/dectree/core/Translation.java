// file: core/src/main/java/io/dectree/core/Translation.java
package io.dectree.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A translation or alternative text owned by exactly one {@link Node}.
 * <p>
 * Fields:
 *  - id:          surrogate id, unique within one index.
 *  - lang:        language code, e.g. "en", "en-ogden", "fr".
 *  - source:      free-text provenance ("Pears/McGuinness 1961", "user").
 *  - variantType: translation (ingested) or alternative (user proposal).
 *  - editor:      optional, only meaningful for alternatives.
 *  - tags:        order-preserving, de-duplicated.
 */
public record Translation(
        int id,
        String lang,
        String text,
        String source,
        VariantType variantType,
        String editor,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt
) {
    public Translation {
        Objects.requireNonNull(lang, "lang");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(variantType, "variantType");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        tags = Tags.normalize(tags);
    }

    public boolean isAlternative() {
        return variantType == VariantType.ALTERNATIVE;
    }
}
