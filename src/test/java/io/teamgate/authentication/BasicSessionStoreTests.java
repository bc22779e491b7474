package io.teamgate.authentication;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.teamgate.authentication.AuthSession.*;
import static org.junit.jupiter.api.Assertions.*;

class BasicSessionStoreTests {

    @Test
    @DisplayName("Initialize basic session store")
    void initStore() {
        BasicSessionStore store = new BasicSessionStore();
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("New sessions are only stored once saved")
    void saveNewSession() {
        BasicSessionStore store = new BasicSessionStore();
        BasicSessionStore.Session session = store.create();
        assertNotNull(session.getId());
        assertNull(store.load(session.getId()));
        session.set(USERNAME, "alice");
        session.save();
        assertEquals(1, store.size());
        assertEquals("alice", store.load(session.getId()).getString(USERNAME));
    }

    @Test
    @DisplayName("Session identifiers are unique")
    void uniqueIdentifiers() {
        BasicSessionStore store = new BasicSessionStore();
        assertNotEquals(store.create().getId(), store.create().getId());
    }

    @Test
    @DisplayName("Loaded sessions are working copies")
    void loadWorkingCopy() {
        BasicSessionStore store = new BasicSessionStore();
        BasicSessionStore.Session session = store.create();
        session.set(ACCESS_LEVEL, "ro");
        session.save();
        BasicSessionStore.Session loaded = store.load(session.getId());
        loaded.set(ACCESS_LEVEL, "rw");
        assertEquals("ro", store.load(session.getId()).get(ACCESS_LEVEL));
        loaded.save();
        assertEquals("rw", store.load(session.getId()).get(ACCESS_LEVEL));
    }

    @Test
    @DisplayName("Marked sessions are dropped instead of saved")
    void dropMarkedSession() {
        BasicSessionStore store = new BasicSessionStore();
        BasicSessionStore.Session session = store.create();
        session.save();
        assertEquals(1, store.size());
        session.mark();
        assertTrue(session.isMarked());
        session.save();
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Destroy a session by identifier")
    void destroyById() {
        BasicSessionStore store = new BasicSessionStore();
        BasicSessionStore.Session session = store.create();
        session.save();
        store.markOrDestroySessionById(session.getId());
        assertNull(store.load(session.getId()));
        // Unknown identifiers are ignored
        store.markOrDestroySessionById("unknown");
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Read typed values from a session")
    void readValues() {
        BasicSessionStore.Session session = new BasicSessionStore().create();
        session.set(TEAM_ID, "team-1");
        session.set("count", 3);
        assertTrue(session.has(TEAM_ID));
        assertFalse(session.has(STATE));
        assertEquals("team-1", session.getString(TEAM_ID));
        assertNull(session.getString("count"));
        assertThrows(NullPointerException.class, () -> session.set(STATE, null));
    }

    @Test
    @DisplayName("A working copy saved after its session was destroyed stays destroyed")
    void saveAfterDestroyById() {
        BasicSessionStore store = new BasicSessionStore();
        BasicSessionStore.Session session = store.create();
        session.set(ACCESS_LEVEL, "rw");
        session.save();
        BasicSessionStore.Session inFlight = store.load(session.getId());

        store.markOrDestroySessionById(session.getId());
        inFlight.set(DESIRED_URL, "/reports");
        inFlight.save();
        assertNull(store.load(session.getId()));
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Destroying a session leaves other sessions savable")
    void destroyKeepsOtherSessions() {
        BasicSessionStore store = new BasicSessionStore();
        BasicSessionStore.Session destroyed = store.create();
        BasicSessionStore.Session kept = store.create();
        destroyed.save();
        store.markOrDestroySessionById(destroyed.getId());
        kept.set(ACCESS_LEVEL, "ro");
        kept.save();
        assertEquals("ro", store.load(kept.getId()).get(ACCESS_LEVEL));
        assertEquals(1, store.size());
    }

}
