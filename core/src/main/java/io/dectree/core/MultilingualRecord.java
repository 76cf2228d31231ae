// file: core/src/main/java/io/dectree/core/MultilingualRecord.java
package io.dectree.core;

import java.util.List;

/**
 * One address with its texts in several languages.
 *
 * @param name  dotted-decimal address; records with a blank name are skipped by ingestion
 * @param texts texts in source order
 */
public record MultilingualRecord(String name, List<LanguageText> texts) {

    public MultilingualRecord {
        texts = texts == null ? List.of() : List.copyOf(texts);
    }

    /**
     * @param lang   language code, e.g. "de", "en-ogden"
     * @param text   body, may be blank (blank texts are not attached)
     * @param source provenance label, e.g. "Ogden 1922"
     */
    public record LanguageText(String lang, String text, String source) {}
}
