// file: core/src/main/java/io/dectree/core/Tags.java
package io.dectree.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Normalisation of free-form tag input: split on commas, trim, drop blanks,
 * keep the first occurrence of each tag.
 */
public final class Tags {

    private Tags() {
        // utility
    }

    public static List<String> normalize(String commaSeparated) {
        if (commaSeparated == null) {
            return List.of();
        }
        return normalize(Arrays.asList(commaSeparated.split(",")));
    }

    public static List<String> normalize(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        var unique = new LinkedHashSet<String>();
        for (String item : raw) {
            if (item == null) continue;
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                unique.add(trimmed);
            }
        }
        return List.copyOf(new ArrayList<>(unique));
    }

    /** Inverse of {@link #normalize(String)}; null when there are no tags. */
    public static String join(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return null;
        }
        return String.join(",", tags);
    }
}
