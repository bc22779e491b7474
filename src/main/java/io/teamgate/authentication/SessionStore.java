package io.teamgate.authentication;

/**
 * The part of the host application's session store the gate relies on to invalidate
 * sessions that are not attached to the current request.
 */
public interface SessionStore {

    /**
     * Invalidates the session identified by <code>sessionId</code>. A session in use by an
     * in-flight request is marked and dropped when that request completes.
     * @param sessionId Opaque session identifier
     */
    void markOrDestroySessionById(String sessionId);

}
