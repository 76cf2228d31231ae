// file: service/src/main/java/io/dectree/service/DectreeRuntime.java
package io.dectree.service;

import io.dectree.core.DuplicateNameException;
import io.dectree.core.Ingestor;
import io.dectree.core.MultilingualRecord;
import io.dectree.core.NodeIndex;
import io.dectree.core.TextResolver;
import io.dectree.service.analysis.AnalysisService;
import io.dectree.service.analysis.CompletionClient;
import io.dectree.service.analysis.EchoCompletionClient;
import io.dectree.service.analysis.PromptBuilder;
import io.dectree.service.prefs.JsonPreferenceStore;
import io.dectree.service.prefs.Preferences;
import io.dectree.storage.DurableResponseCache;
import io.dectree.storage.FileIndexSnapshotter;
import io.dectree.storage.IndexSnapshotter;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the index, cache, preferences and analysis pipeline together.
 * <p>
 * Startup:
 *  1) load the latest index snapshot (an empty index if there is none);
 *  2) open the response cache and replay its log;
 *  3) load preferences;
 *  4) build the text resolver, analysis service and session registry.
 */
public final class DectreeRuntime implements AutoCloseable {
    private static final Logger log = Logger.getLogger(DectreeRuntime.class.getName());

    private final RuntimeConfig config;
    private final NodeIndex index;
    private final IndexSnapshotter snapshotter;
    private final DurableResponseCache cache;
    private final Preferences preferences;
    private final TextResolver resolver;
    private final AnalysisService analysis;
    private final SessionRegistry sessions;

    private DectreeRuntime(RuntimeConfig config,
                           NodeIndex index,
                           IndexSnapshotter snapshotter,
                           DurableResponseCache cache,
                           Preferences preferences,
                           CompletionClient client) {
        this.config = config;
        this.index = index;
        this.snapshotter = snapshotter;
        this.cache = cache;
        this.preferences = preferences;
        this.resolver = new TextResolver(config.originalLanguage());
        this.analysis = new AnalysisService(index, resolver, cache, client, preferences, new PromptBuilder());
        this.sessions = new SessionRegistry(this::newSession);
    }

    /** Open with the placeholder completion backend. */
    public static DectreeRuntime open(RuntimeConfig config) {
        return open(config, new EchoCompletionClient());
    }

    public static DectreeRuntime open(RuntimeConfig config, CompletionClient client) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(client, "client");

        var snapshotter = new FileIndexSnapshotter(config.indexDir());
        NodeIndex index = snapshotter.loadLatest();
        if (index == null) {
            log.log(Level.WARNING, "no index snapshot in " + config.indexDir() + ", starting with an empty index");
            index = NodeIndex.restore(List.of());
        }
        var cache = DurableResponseCache.open(config.cacheDir());
        var prefs = new JsonPreferenceStore(config.preferencesFile());
        log.log(Level.INFO, "runtime ready: " + index.size() + " nodes, " + cache.size() + " cached responses");
        return new DectreeRuntime(config, index, snapshotter, cache, prefs, client);
    }

    /**
     * Ingest {@code records} and write the result as the latest index snapshot.
     * A batch with a repeated name writes nothing and fails with DUPLICATE_NAME.
     *
     * @return snapshot identifier
     */
    public static NavResult<String> ingest(RuntimeConfig config, List<MultilingualRecord> records) {
        NodeIndex index;
        try {
            index = new Ingestor(config.originalLanguage(), Clock.systemUTC()).ingestMultilingual(records);
        } catch (DuplicateNameException e) {
            log.log(Level.WARNING, "ingestion rejected: " + e.getMessage());
            return NavResult.failure(ErrorKind.DUPLICATE_NAME, e.getMessage());
        }
        return NavResult.ok(new FileIndexSnapshotter(config.indexDir()).write(index));
    }

    public NavigationSession newSession() {
        return new NavigationSession(index, resolver, preferences);
    }

    /** Persist translations and alternatives added since startup. */
    public String saveIndex() {
        return snapshotter.write(index);
    }

    public RuntimeConfig config() { return config; }

    public NodeIndex index() { return index; }

    public DurableResponseCache cache() { return cache; }

    public Preferences preferences() { return preferences; }

    public TextResolver resolver() { return resolver; }

    public AnalysisService analysis() { return analysis; }

    public SessionRegistry sessions() { return sessions; }

    @Override
    public void close() throws Exception {
        cache.close();
    }
}
