// file: service/src/main/java/io/dectree/service/prefs/Preferences.java
package io.dectree.service.prefs;

import java.util.Map;

/**
 * Typed access to user preferences.
 * <p>
 * set() and setFromString() validate first and leave the stored value
 * untouched when validation fails.
 */
public interface Preferences {

    Object get(Preference preference);

    default int getInt(Preference preference) {
        if (preference.kind() != Preference.Kind.INT) {
            throw new IllegalArgumentException(preference.key() + " is not an integer preference");
        }
        return (Integer) get(preference);
    }

    default String getString(Preference preference) {
        if (preference.kind() != Preference.Kind.STRING) {
            throw new IllegalArgumentException(preference.key() + " is not a string preference");
        }
        return (String) get(preference);
    }

    PreferenceValidation set(Preference preference, Object value);

    /** Look up {@code key} in the schema and convert {@code raw} by its declared kind. */
    default PreferenceValidation setFromString(String key, String raw) {
        return Preference.byKey(key)
                .map(p -> {
                    PreferenceValidation parsed = p.parse(raw);
                    return parsed.valid() ? set(p, parsed.value()) : parsed;
                })
                .orElseGet(() -> PreferenceValidation.invalid("Unknown preference: " + key));
    }

    /** Restore the default of one preference. */
    void reset(Preference preference);

    /** Restore every default. */
    void resetAll();

    /** Current values keyed by schema key, in schema order. */
    Map<String, Object> asMap();
}
