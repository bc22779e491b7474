package io.teamgate.authentication;

import com.nimbusds.oauth2.sdk.id.Identifier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Basic in-memory implementation of {@link SessionStore} for hosts that keep their sessions
 * in process. Sessions are created and loaded through the store and persisted by
 * {@link AuthSession#save()}.
 * <p>
 * Identifiers destroyed through {@link #markOrDestroySessionById(String)} are remembered, so a
 * working copy loaded before the destruction is dropped rather than written back when its
 * request saves it.
 */
@Slf4j
public class BasicSessionStore implements SessionStore {

    private final ConcurrentHashMap<String, Map<String, Object>> sessions;
    private final Set<String> destroyed;

    /**
     * Initializes a new Concurrent (thread safe) Hash Map for storage and retrieval
     * of session contents
     */
    public BasicSessionStore() {
        this.sessions = new ConcurrentHashMap<>();
        this.destroyed = ConcurrentHashMap.newKeySet();
    }

    /**
     * Creates a new, empty session with a random identifier. It is only stored once saved.
     * @return {@link Session}
     */
    public Session create() { return new Session(new Identifier().getValue(), Map.of()); }

    /**
     * Loads the stored session with the provided identifier
     * @param sessionId Session identifier
     * @return {@link Session} or null if it doesn't exist
     */
    public Session load(String sessionId) {
        Objects.requireNonNull(sessionId, "Must provide a session identifier to load a session");
        Map<String, Object> values = this.sessions.get(sessionId);
        return values == null ? null : new Session(sessionId, values);
    }

    @Override
    public void markOrDestroySessionById(String sessionId) {
        Objects.requireNonNull(sessionId, "Must provide a session identifier to destroy a session");
        // Recorded before removal so that a concurrent save either sees it or is undone by the removal
        this.destroyed.add(sessionId);
        if (this.sessions.remove(sessionId) != null) { log.debug("Destroyed session {}", sessionId); }
    }

    /**
     * Returns the size of the in-memory session store
     * @return number of sessions
     */
    public int size() { return this.sessions.size(); }

    /**
     * Working copy of a stored session
     */
    public class Session implements AuthSession {

        @Getter
        private final String id;
        private final Map<String, Object> values;
        @Getter
        private boolean marked;

        private Session(String id, Map<String, Object> values) {
            this.id = id;
            this.values = new ConcurrentHashMap<>(values);
        }

        @Override
        public Object get(String key) { return this.values.get(key); }

        @Override
        public void set(String key, Object value) {
            Objects.requireNonNull(key, "Must provide a key to set in a session");
            Objects.requireNonNull(value, "Must provide a value to set in a session");
            this.values.put(key, value);
        }

        @Override
        public boolean has(String key) { return this.values.containsKey(key); }

        @Override
        public void mark() { this.marked = true; }

        /**
         * Stores the contents of the session, or drops it from the store once marked or
         * destroyed by identifier
         */
        @Override
        public void save() {
            Map<String, Object> contents = Map.copyOf(this.values);
            sessions.compute(this.id, (id, current) -> {
                if (this.marked || destroyed.contains(id)) {
                    log.debug("Dropping invalidated session {} on save", id);
                    return null;
                }
                return contents;
            });
        }

    }

}
