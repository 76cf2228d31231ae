// file: service/src/main/java/io/dectree/service/analysis/TargetRange.java
package io.dectree.service.analysis;

import io.dectree.core.Node;
import io.dectree.core.NodeIndex;

import java.util.List;
import java.util.Optional;

/**
 * Inclusive range of node names, written "a-b" or "a:b".
 * <p>
 * Ranges cover every existing name between the endpoints in natural order,
 * so "1.1-1.10" includes "1.2" but not "1.11". Both endpoints must exist.
 */
public record TargetRange(String from, String to) {

    /**
     * @return the range, or empty if {@code token} is a plain name
     * @throws InvalidRangeException if the token has a separator but an empty side
     */
    public static Optional<TargetRange> parse(String token) {
        String t = token.trim();
        int sep = separatorIndex(t);
        if (sep < 0) {
            return Optional.empty();
        }
        String from = t.substring(0, sep).trim();
        String to = t.substring(sep + 1).trim();
        if (from.isEmpty() || to.isEmpty() || separatorIndex(to) >= 0) {
            throw new InvalidRangeException("Malformed range: '" + token + "'. Use a-b or a:b.");
        }
        return Optional.of(new TargetRange(from, to));
    }

    /** @throws InvalidRangeException if an endpoint is not a known name */
    public List<Node> resolve(NodeIndex index) {
        for (String endpoint : List.of(from, to)) {
            if (!index.containsName(endpoint)) {
                throw new InvalidRangeException("Unknown range endpoint: '" + endpoint + "'.");
            }
        }
        return index.rangeBetween(from, to);
    }

    private static int separatorIndex(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '-' || c == ':') return i;
        }
        return -1;
    }
}
