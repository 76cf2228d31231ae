// file: service/src/main/java/io/dectree/service/SessionRegistry.java
package io.dectree.service;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Navigation sessions keyed by a caller-supplied id (e.g. one per web client).
 * <p>
 * The registry itself is thread-safe; each session is still single-caller.
 */
public final class SessionRegistry {
    private static final Logger log = Logger.getLogger(SessionRegistry.class.getName());

    private final Map<String, NavigationSession> sessions = new ConcurrentHashMap<>();
    private final Supplier<NavigationSession> factory;

    public SessionRegistry(Supplier<NavigationSession> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public NavigationSession getOrCreate(String sessionId) {
        requireId(sessionId);
        return sessions.computeIfAbsent(sessionId, id -> {
            log.log(Level.FINE, "creating navigation session " + id);
            return factory.get();
        });
    }

    public Optional<NavigationSession> get(String sessionId) {
        requireId(sessionId);
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /** @return true if a session was removed */
    public boolean evict(String sessionId) {
        requireId(sessionId);
        return sessions.remove(sessionId) != null;
    }

    public int size() {
        return sessions.size();
    }

    private static void requireId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
    }
}
