package io.teamgate.authentication;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Establishes who the holder of a GitHub access token is and which access level they are
 * entitled to, then records the outcome in their session and in the {@link SessionIndex}.
 * The index is only touched once the whole exchange with GitHub succeeded, so an aborted
 * attempt leaves nothing behind.
 */
@Slf4j
public class LoginDance {

    private final GitHubClientFactory clientFactory;
    private final TeamMatcher teamMatcher;
    private final SessionIndex sessionIndex;
    private final String defaultTeamId;

    public LoginDance(GitHubClientFactory clientFactory, TeamMatcher teamMatcher, SessionIndex sessionIndex, String defaultTeamId) {
        Objects.requireNonNull(clientFactory, "Must provide a GitHub client factory for the login dance");
        Objects.requireNonNull(teamMatcher, "Must provide a team matcher for the login dance");
        Objects.requireNonNull(sessionIndex, "Must provide a session index for the login dance");
        Objects.requireNonNull(defaultTeamId, "Must provide a default team identifier for the login dance");
        this.clientFactory = clientFactory;
        this.teamMatcher = teamMatcher;
        this.sessionIndex = sessionIndex;
        this.defaultTeamId = defaultTeamId;
    }

    /**
     * Performs the login dance for <code>accessToken</code>. An unauthorized caller has their
     * session cleaned up; other cleanup is left to the caller.
     * @param accessToken GitHub access token of the caller
     * @param session Session of the caller
     * @return {@link LoginResult}
     */
    public LoginResult perform(AccessToken accessToken, AuthSession session) {
        Objects.requireNonNull(accessToken, "Must provide an access token for the login dance");
        Objects.requireNonNull(session, "Must provide a session for the login dance");
        GitHubClient client;
        try {
            client = this.clientFactory.create(accessToken);
        } catch (GateAuthenticationException ex) {
            log.error("Failed to create GitHub client: {}", ex.getMessage(), ex);
            return LoginResult.INTERNAL_FAILURE;
        }

        String username;
        try {
            username = client.getAuthenticatedLogin();
        } catch (InvalidTokenException ex) {
            log.debug("Login dance with a rejected token: {}", ex.getMessage());
            return unauthorized(session);
        } catch (GateAuthenticationException ex) {
            log.error("Failed to get authenticated user: {}", ex.getMessage(), ex);
            return LoginResult.INTERNAL_FAILURE;
        }
        if (username == null) {
            log.error("Authenticated as a user without a login");
            return unauthorized(session);
        }

        TeamMatch match;
        try {
            match = this.teamMatcher.match(client.listUserTeams(), client.listUserOrganizations());
        } catch (GateAuthenticationException ex) {
            log.error("Failed to get teams and organizations of {}: {}", username, ex.getMessage(), ex);
            return LoginResult.INTERNAL_FAILURE;
        }
        if (!match.isAuthorized()) {
            log.debug("User {} is not authorized", username);
            return unauthorized(session);
        }

        session.set(AuthSession.ACCESS_LEVEL, match.getAccessLevel().getValue());
        session.set(AuthSession.TEAM_ID, this.defaultTeamId);
        session.set(AuthSession.USERNAME, username);
        try {
            session.save();
        } catch (GateAuthenticationException ex) {
            log.error("Failed to save the session of {}: {}", username, ex.getMessage(), ex);
            return LoginResult.INTERNAL_FAILURE;
        }
        this.sessionIndex.add(username, session.getId(), match.getBinding());
        log.debug("User {} logged in with {} access through {}", username, match.getAccessLevel(), match.getBinding());
        return LoginResult.OK;
    }

    /**
     * Removes the caller's session from the index (when it was indexed) and marks it for
     * destruction
     * @param session Session of the caller
     */
    public void cleanupSession(AuthSession session) {
        Objects.requireNonNull(session, "Must provide a session to clean up");
        try {
            String username = session.getString(AuthSession.USERNAME);
            if (username != null) { this.sessionIndex.remove(username, session.getId()); }
        } finally {
            session.mark();
        }
    }

    private LoginResult unauthorized(AuthSession session) {
        cleanupSession(session);
        return LoginResult.UNAUTHORIZED;
    }

}
