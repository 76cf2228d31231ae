// file: core/src/main/java/io/dectree/core/HierarchyResolver.java
package io.dectree.core;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Parent and depth computation for dotted-decimal addresses.
 * <p>
 * Parent rule (longest existing proper prefix):
 *  - a name without "." is a root;
 *  - otherwise try name[0:len-1], name[0:len-2], ... name[0:1] and return the
 *    first candidate that is a known address.
 * <p>
 * Dropping the trailing segment is not enough: with {"2", "2.01", "2.011"}
 * the parent of "2.0121" is "2.01", because "2.012" was never ingested.
 */
public final class HierarchyResolver {

    private HierarchyResolver() {
        // utility
    }

    /**
     * @param name  address to resolve
     * @param known complete set of addresses of the corpus
     * @return parent address (always a strict prefix of {@code name}), or empty for a root
     */
    public static Optional<String> parentOf(String name, Set<String> known) {
        if (name == null || name.indexOf('.') < 0) {
            return Optional.empty();
        }
        for (int length = name.length() - 1; length >= 1; length--) {
            String candidate = name.substring(0, length);
            if (known.contains(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Depth of {@code name}: 1 for a root, +1 per parent hop.
     * <p>
     * The walk remembers every address it has seen. If the chain revisits one
     * (corrupt, self-referential data) the walk stops and the depth counted so
     * far is returned.
     *
     * @param parentLookup returns the parent address of its argument, or null for a root
     */
    public static int depthOf(String name, Function<String, String> parentLookup) {
        int level = 1;
        Set<String> visited = new HashSet<>();
        visited.add(name);
        String current = parentLookup.apply(name);
        while (current != null && visited.add(current)) {
            level++;
            current = parentLookup.apply(current);
        }
        return level;
    }
}
