package io.teamgate.authentication;

import lombok.Getter;

import java.io.Serializable;
import java.util.Objects;

/**
 * General representation of a GitHub access token, whether obtained through the
 * authorization code exchange or presented directly as a bearer token.
 */
@Getter
public class AccessToken implements Serializable {

    protected final String value;

    /**
     * Construct a new AccessToken
     * @param value Value of the token itself
     */
    public AccessToken(String value) {
        Objects.requireNonNull(value, "Must provide an access token value");
        this.value = value;
    }

    @Override
    public String toString() { return "AccessToken[redacted]"; }

}
