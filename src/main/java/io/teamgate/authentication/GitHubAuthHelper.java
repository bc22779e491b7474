package io.teamgate.authentication;

import java.util.Map;
import java.util.Objects;

/**
 * Assorted helper methods for working with GitHub tokens, headers and JSON documents.
 * JSON is parsed with the utilities of the
 * <a href="https://connect2id.com/products/nimbus-oauth-openid-connect-sdk">Nimbus SDK</a>,
 * which yields plain maps and lists.
 */
public class GitHubAuthHelper {

    public static final String AUTHORIZATION = "Authorization";
    public static final String ACCEPT = "Accept";
    public static final String GITHUB_JSON = "application/vnd.github+json";
    private static final String BEARER = "bearer";

    private GitHubAuthHelper() { }

    /**
     * Extracts the access token from the value of an Authorization header.
     * @param value Value of the Authorization header
     * @return Access token, or null if the scheme isn't Bearer
     * @throws MalformedInputException if the value isn't made of a scheme and a credential
     */
    public static AccessToken getAccessTokenFromHeader(String value) throws MalformedInputException {
        Objects.requireNonNull(value, "Must provide an authorization header value to get token from");
        String[] split = value.trim().split("\\s+");
        if (split.length != 2) { throw new MalformedInputException("Malformed authorization header"); }
        if (!BEARER.equalsIgnoreCase(split[0])) { return null; }
        return new AccessToken(split[1]);
    }

    /**
     * Translates a nimbus native AccessToken into the gate's format
     * @param nimbusAccessToken Nimbus AccessToken
     * @return AccessToken in the gate's format
     */
    public static AccessToken translateAccessToken(com.nimbusds.oauth2.sdk.token.AccessToken nimbusAccessToken) {
        Objects.requireNonNull(nimbusAccessToken, "Must provide an access token to translate");
        return new AccessToken(nimbusAccessToken.getValue());
    }

    /**
     * Walks <code>path</code> down nested JSON objects and returns the string found at its end
     * @param json Parsed JSON object (a Map)
     * @param path Keys to follow
     * @return String value, or null if any step is missing or of another type
     */
    public static String getString(Object json, String... path) {
        Object current = json;
        for (String key : path) {
            if (!(current instanceof Map)) { return null; }
            current = ((Map<?, ?>) current).get(key);
        }
        return current instanceof String ? (String) current : null;
    }

}
