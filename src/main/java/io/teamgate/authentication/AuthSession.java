package io.teamgate.authentication;

/**
 * The session of the current caller, owned by the host application's session store. The
 * gate keeps its state under the keys declared here.
 */
public interface AuthSession {

    String STATE = "state";
    String DESIRED_URL = "desiredurl";
    String ACCESS_LEVEL = "accesslevel";
    String TEAM_ID = "teamID";
    String USERNAME = "username";

    /**
     * @return Opaque identifier of the session, stable for its lifetime
     */
    String getId();

    Object get(String key);

    void set(String key, Object value);

    boolean has(String key);

    /**
     * Flags the session for destruction. The store drops it instead of persisting it.
     */
    void mark();

    /**
     * Persists the current contents of the session
     * @throws GateAuthenticationException if the session could not be stored
     */
    void save() throws GateAuthenticationException;

    /**
     * Gets a value stored as a string
     * @param key Session key
     * @return String value or null if absent or of another type
     */
    default String getString(String key) {
        Object value = get(key);
        return value instanceof String ? (String) value : null;
    }

}
