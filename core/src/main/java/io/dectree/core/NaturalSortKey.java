// file: core/src/main/java/io/dectree/core/NaturalSortKey.java
package io.dectree.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Comparable token sequence for dotted-decimal names.
 * <p>
 * A name is split into alternating runs: digit runs become integers, every
 * other run stays a string. "1.10" becomes [1, ".", 10], so comparing keys
 * token by token yields
 * <pre>
 *   "1.2" &lt; "1.10" &lt; "1.11" &lt; "2"
 * </pre>
 * Ordering rules:
 *  - integer vs integer: numeric, any length (no overflow).
 *  - string vs string: lexicographic.
 *  - integer vs string: integer first.
 *  - a key that is a prefix of another sorts first.
 *  - equal token sequences ("01" vs "1") fall back to the raw strings.
 */
public final class NaturalSortKey implements Comparable<NaturalSortKey> {

    /** Natural order over raw names. */
    public static final Comparator<String> NAME_ORDER = Comparator.comparing(NaturalSortKey::of);

    /** Natural order over nodes by name. */
    public static final Comparator<Node> NODE_ORDER = Comparator.comparing(n -> of(n.name()));

    private final String raw;
    private final List<Object> tokens;

    private NaturalSortKey(String raw, List<Object> tokens) {
        this.raw = raw;
        this.tokens = tokens;
    }

    public static NaturalSortKey of(String name) {
        Objects.requireNonNull(name, "name");
        List<Object> out = new ArrayList<>();
        int i = 0;
        while (i < name.length()) {
            boolean digits = isAsciiDigit(name.charAt(i));
            int j = i + 1;
            while (j < name.length() && isAsciiDigit(name.charAt(j)) == digits) {
                j++;
            }
            String run = name.substring(i, j);
            out.add(digits ? new BigInteger(run) : run);
            i = j;
        }
        return new NaturalSortKey(name, List.copyOf(out));
    }

    /** Tokens in order: {@link BigInteger} for digit runs, {@link String} otherwise. */
    public List<Object> tokens() {
        return tokens;
    }

    public String raw() {
        return raw;
    }

    @Override
    public int compareTo(NaturalSortKey other) {
        int n = Math.min(tokens.size(), other.tokens.size());
        for (int i = 0; i < n; i++) {
            int c = compareTokens(tokens.get(i), other.tokens.get(i));
            if (c != 0) return c;
        }
        if (tokens.size() != other.tokens.size()) {
            return Integer.compare(tokens.size(), other.tokens.size());
        }
        return raw.compareTo(other.raw);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NaturalSortKey k && raw.equals(k.raw);
    }

    @Override
    public int hashCode() {
        return raw.hashCode();
    }

    @Override
    public String toString() {
        return tokens.toString();
    }

    private static int compareTokens(Object a, Object b) {
        if (a instanceof BigInteger x && b instanceof BigInteger y) {
            return x.compareTo(y);
        }
        if (a instanceof String x && b instanceof String y) {
            return x.compareTo(y);
        }
        return a instanceof BigInteger ? -1 : 1;
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
