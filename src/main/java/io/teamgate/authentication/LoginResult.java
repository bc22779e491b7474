package io.teamgate.authentication;

/**
 * Outcome of an authentication attempt
 */
public enum LoginResult {
    /** The caller holds access and their session was saved and indexed */
    OK,
    /** The caller was identified but holds no access, or could not be identified */
    UNAUTHORIZED,
    /** GitHub or the session store failed */
    INTERNAL_FAILURE
}
