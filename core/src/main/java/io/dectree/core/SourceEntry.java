// file: core/src/main/java/io/dectree/core/SourceEntry.java
package io.dectree.core;

import java.util.Objects;

/** One flat input row: an address and its primary-language text. */
public record SourceEntry(String name, String text) {
    public SourceEntry {
        Objects.requireNonNull(text, "text");
    }
}
