package io.teamgate.authentication;

/**
 * Creates a {@link GitHubClient} acting with a given access token
 */
@FunctionalInterface
public interface GitHubClientFactory {

    GitHubClient create(AccessToken accessToken) throws GateAuthenticationException;

}
