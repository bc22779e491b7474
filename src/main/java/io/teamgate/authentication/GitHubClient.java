package io.teamgate.authentication;

/**
 * The queries the gate makes to GitHub on behalf of an authenticated user
 */
public interface GitHubClient {

    /**
     * Gets the login of the authenticated user
     * @return login or null when GitHub reports the user without one
     * @throws GateAuthenticationException when the request fails
     */
    String getAuthenticatedLogin() throws GateAuthenticationException;

    /**
     * Lists the teams of the authenticated user, across all of their organizations
     * @return {@link PagedResults} of {@link GitHubTeam}
     */
    PagedResults<GitHubTeam> listUserTeams();

    /**
     * Lists the logins of the organizations of the authenticated user. Entries without a
     * login are reported as null.
     * @return {@link PagedResults} of organization logins
     */
    PagedResults<String> listUserOrganizations();

}
