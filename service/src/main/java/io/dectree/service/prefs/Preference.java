// file: service/src/main/java/io/dectree/service/prefs/Preference.java
package io.dectree.service.prefs;

import java.util.Optional;

/**
 * Fixed preference schema.
 * <p>
 * Each entry declares its key, kind, bounds and default. Validation is driven
 * by the declared kind only; the type of the default is never consulted.
 * <pre>
 *   display_length    int     1..1000   60
 *   lines_per_output  int     1..1000   10
 *   lang              string            "en"
 *   llm_max_tokens    int     10..4000  500
 *   tree_max_depth    int     0..12     0 (unlimited)
 * </pre>
 */
public enum Preference {
    DISPLAY_LENGTH("display_length", Kind.INT, 1, 1000, 60),
    LINES_PER_OUTPUT("lines_per_output", Kind.INT, 1, 1000, 10),
    LANG("lang", Kind.STRING, 0, 0, "en"),
    LLM_MAX_TOKENS("llm_max_tokens", Kind.INT, 10, 4000, 500),
    TREE_MAX_DEPTH("tree_max_depth", Kind.INT, 0, 12, 0);

    public enum Kind { INT, STRING }

    private final String key;
    private final Kind kind;
    private final int min;
    private final int max;
    private final Object defaultValue;

    Preference(String key, Kind kind, int min, int max, Object defaultValue) {
        this.key = key;
        this.kind = kind;
        this.min = min;
        this.max = max;
        this.defaultValue = defaultValue;
    }

    public String key() { return key; }

    public Kind kind() { return kind; }

    /** Lower bound for INT preferences. */
    public int min() { return min; }

    /** Upper bound for INT preferences. */
    public int max() { return max; }

    public Object defaultValue() { return defaultValue; }

    public static Optional<Preference> byKey(String key) {
        if (key == null) return Optional.empty();
        for (Preference p : values()) {
            if (p.key.equals(key.trim())) return Optional.of(p);
        }
        return Optional.empty();
    }

    /** Check kind, then bounds. Integral numbers are normalised to Integer. */
    public PreferenceValidation validate(Object value) {
        if (value == null) {
            return PreferenceValidation.invalid(key + " must not be null");
        }
        switch (kind) {
            case INT -> {
                if (!(value instanceof Integer || value instanceof Long || value instanceof Short)) {
                    return PreferenceValidation.invalid(key + " must be an integer, got " + value.getClass().getSimpleName());
                }
                long v = ((Number) value).longValue();
                if (v < min || v > max) {
                    return PreferenceValidation.invalid(key + " must be between " + min + " and " + max);
                }
                return PreferenceValidation.ok((int) v);
            }
            case STRING -> {
                if (!(value instanceof String s)) {
                    return PreferenceValidation.invalid(key + " must be a string, got " + value.getClass().getSimpleName());
                }
                if (s.isBlank()) {
                    return PreferenceValidation.invalid(key + " must not be blank");
                }
                return PreferenceValidation.ok(s.trim());
            }
            default -> throw new IllegalStateException("unhandled kind " + kind);
        }
    }

    /** Convert command-line style input by declared kind, then validate. */
    public PreferenceValidation parse(String raw) {
        if (raw == null) {
            return PreferenceValidation.invalid(key + " requires a value");
        }
        if (kind == Kind.INT) {
            try {
                return validate(Integer.parseInt(raw.trim()));
            } catch (NumberFormatException e) {
                return PreferenceValidation.invalid(key + " must be an integer, got '" + raw + "'");
            }
        }
        return validate(raw);
    }
}
