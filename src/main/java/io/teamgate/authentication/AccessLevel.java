package io.teamgate.authentication;

import lombok.Getter;

/**
 * Access level granted to an authenticated session. The value is what gets stored
 * under the <code>accesslevel</code> key of the session.
 */
@Getter
public enum AccessLevel {

    NONE(""),
    READ_ONLY("ro"),
    READ_WRITE("rw");

    private final String value;

    AccessLevel(String value) { this.value = value; }

    /**
     * Resolves the access level stored in a session
     * @param value stored value (may be null)
     * @return matching {@link AccessLevel} or {@link #NONE}
     */
    public static AccessLevel fromValue(Object value) {
        if (READ_WRITE.value.equals(value)) { return READ_WRITE; }
        if (READ_ONLY.value.equals(value)) { return READ_ONLY; }
        return NONE;
    }

}
