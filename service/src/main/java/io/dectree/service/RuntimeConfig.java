// file: service/src/main/java/io/dectree/service/RuntimeConfig.java
package io.dectree.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dectree.core.TextResolver;
import io.dectree.service.dto.JsonRuntimeConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Locations and settings needed to open a {@link DectreeRuntime}.
 *
 *  - indexDir:         directory holding index snapshots
 *  - cacheDir:         directory holding the response cache log
 *  - preferencesFile:  JSON preferences file
 *  - originalLanguage: language of the node bodies, e.g. "de"
 */
public record RuntimeConfig(
        Path indexDir,
        Path cacheDir,
        Path preferencesFile,
        String originalLanguage
) {
    public static final Path DEFAULT_INDEX_DIR = Path.of("./data/index");
    public static final Path DEFAULT_CACHE_DIR = Path.of("./data/cache");
    public static final String PREFERENCES_FILE_NAME = ".dectreerc";

    public RuntimeConfig {
        Objects.requireNonNull(indexDir, "indexDir");
        Objects.requireNonNull(cacheDir, "cacheDir");
        Objects.requireNonNull(preferencesFile, "preferencesFile");
        Objects.requireNonNull(originalLanguage, "originalLanguage");
        if (originalLanguage.isBlank()) throw new IllegalArgumentException("originalLanguage must not be blank");
    }

    public static RuntimeConfig defaults() {
        return new RuntimeConfig(
                DEFAULT_INDEX_DIR,
                DEFAULT_CACHE_DIR,
                Path.of(System.getProperty("user.home"), PREFERENCES_FILE_NAME),
                TextResolver.DEFAULT_ORIGINAL_LANGUAGE
        );
    }

    /** All directories below {@code base}; handy for tests and embedded use. */
    public static RuntimeConfig under(Path base) {
        return new RuntimeConfig(
                base.resolve("index"),
                base.resolve("cache"),
                base.resolve(PREFERENCES_FILE_NAME),
                TextResolver.DEFAULT_ORIGINAL_LANGUAGE
        );
    }

    /** Read a JSON config; missing fields keep their {@link #defaults()} value. */
    public static RuntimeConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            JsonRuntimeConfig cfg = mapper.readValue(path.toFile(), JsonRuntimeConfig.class);
            RuntimeConfig d = defaults();
            return new RuntimeConfig(
                    cfg.indexDir != null ? Path.of(cfg.indexDir) : d.indexDir(),
                    cfg.cacheDir != null ? Path.of(cfg.cacheDir) : d.cacheDir(),
                    cfg.preferencesFile != null ? Path.of(cfg.preferencesFile) : d.preferencesFile(),
                    cfg.originalLanguage != null ? cfg.originalLanguage : d.originalLanguage()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load RuntimeConfig from " + path, e);
        }
    }
}
