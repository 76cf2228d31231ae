// file: service/src/main/java/io/dectree/service/prefs/MemoryPreferenceStore.java
package io.dectree.service.prefs;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Preferences held in memory only; the base for {@link JsonPreferenceStore}. */
public class MemoryPreferenceStore implements Preferences {
    private final Map<Preference, Object> values = new EnumMap<>(Preference.class);

    public MemoryPreferenceStore() {
        for (Preference p : Preference.values()) {
            values.put(p, p.defaultValue());
        }
    }

    @Override
    public synchronized Object get(Preference preference) {
        return values.get(Objects.requireNonNull(preference, "preference"));
    }

    @Override
    public synchronized PreferenceValidation set(Preference preference, Object value) {
        PreferenceValidation v = preference.validate(value);
        if (v.valid()) {
            commit(() -> values.put(preference, v.value()));
        }
        return v;
    }

    @Override
    public synchronized void reset(Preference preference) {
        commit(() -> values.put(preference, preference.defaultValue()));
    }

    @Override
    public synchronized void resetAll() {
        commit(() -> {
            for (Preference p : Preference.values()) {
                values.put(p, p.defaultValue());
            }
        });
    }

    @Override
    public synchronized Map<String, Object> asMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (var e : values.entrySet()) {
            out.put(e.getKey().key(), e.getValue());
        }
        return out;
    }

    // A failed changed() puts the previous values back before rethrowing.
    private void commit(Runnable mutation) {
        Map<Preference, Object> before = new EnumMap<>(values);
        mutation.run();
        try {
            changed();
        } catch (RuntimeException e) {
            values.clear();
            values.putAll(before);
            throw e;
        }
    }

    /** Store a value that has already been validated, without notifying. */
    protected synchronized void load(Preference preference, Object validatedValue) {
        values.put(preference, validatedValue);
    }

    /** Called with the monitor held after every successful mutation. */
    protected void changed() {
    }
}
