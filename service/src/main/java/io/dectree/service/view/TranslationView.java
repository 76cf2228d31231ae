// file: service/src/main/java/io/dectree/service/view/TranslationView.java
package io.dectree.service.view;

import io.dectree.core.Translation;

import java.time.Instant;
import java.util.List;

/** Translation or alternative as returned to callers; a missing source reads "unknown". */
public record TranslationView(
        int id,
        String lang,
        String text,
        String source,
        String editor,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt
) {
    public static TranslationView of(Translation t) {
        return new TranslationView(
                t.id(),
                t.lang(),
                t.text(),
                t.source() == null || t.source().isBlank() ? "unknown" : t.source(),
                t.editor() == null ? "" : t.editor(),
                t.tags(),
                t.createdAt(),
                t.updatedAt()
        );
    }
}
