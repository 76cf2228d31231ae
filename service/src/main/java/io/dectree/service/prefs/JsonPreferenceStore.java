// file: service/src/main/java/io/dectree/service/prefs/JsonPreferenceStore.java
package io.dectree.service.prefs;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Preferences persisted as one JSON object, e.g.
 * <pre>
 *   {
 *     "display_length": 100,
 *     "lines_per_output": 20,
 *     "lang": "en",
 *     "llm_max_tokens": 800,
 *     "tree_max_depth": 5
 *   }
 * </pre>
 * Loading:
 *  - a missing file means defaults;
 *  - unknown keys are ignored;
 *  - values failing validation are ignored with a warning;
 *  - a malformed file logs a warning and leaves every default in place.
 * <p>
 * Every successful set/reset rewrites the file.
 */
public class JsonPreferenceStore extends MemoryPreferenceStore {
    private static final Logger log = Logger.getLogger(JsonPreferenceStore.class.getName());

    private final Path file;
    private final ObjectMapper mapper = new ObjectMapper();

    public JsonPreferenceStore(Path file) {
        this.file = file;
        loadFromFile();
    }

    public Path file() {
        return file;
    }

    @Override
    protected void changed() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), asMap());
        } catch (IOException e) {
            throw new RuntimeException("Failed to save preferences to " + file, e);
        }
    }

    private void loadFromFile() {
        if (!Files.exists(file)) return;
        Map<String, Object> data;
        try {
            data = mapper.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            log.log(Level.WARNING, "Could not load preferences from " + file + ", using defaults", e);
            return;
        }
        if (data == null) return;
        for (var e : data.entrySet()) {
            var pref = Preference.byKey(e.getKey());
            if (pref.isEmpty()) continue;
            PreferenceValidation v = pref.get().validate(e.getValue());
            if (v.valid()) {
                load(pref.get(), v.value());
            } else {
                log.log(Level.WARNING, "Ignoring preference from " + file + ": " + v.message());
            }
        }
    }
}
