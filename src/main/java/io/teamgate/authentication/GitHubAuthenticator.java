package io.teamgate.authentication;

import com.nimbusds.oauth2.sdk.id.State;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import static io.teamgate.authentication.AuthSession.*;
import static io.teamgate.authentication.GitHubAuthHelper.AUTHORIZATION;
import static io.teamgate.authentication.GitHubAuthHelper.getAccessTokenFromHeader;

/**
 * Authenticates requests against GitHub team and organization membership. Owns the
 * {@link SessionIndex} of the process for its whole lifetime.
 * <p>
 * The host application routes {@link #CALLBACK_PATH} to {@link #handleCallback(GateRequest, AuthSession)},
 * {@link #WEBHOOK_PATH} to {@link #handleWebhook(GateRequest)}, and passes every other
 * request through {@link #authenticate(GateRequest, AuthSession)}.
 */
@Slf4j
public class GitHubAuthenticator {

    public static final String CALLBACK_PATH = "/login/cb";
    public static final String WEBHOOK_PATH = "/login/webhook";
    private static final Set<String> READ_ONLY_METHODS = Set.of("GET", "HEAD");

    @Getter
    private final SessionIndex sessionIndex;
    private final GitHubOAuthFlow oauthFlow;
    private final LoginDance loginDance;
    private final WebhookDispatcher webhookDispatcher;

    /**
     * Construct a GitHubAuthenticator querying GitHub through <code>httpClient</code>
     * @param config {@link GitHubAuthConfig}
     * @param sessionStore Store holding the sessions of the host application
     * @param httpClient OkHttp client used for GitHub API calls
     */
    public GitHubAuthenticator(GitHubAuthConfig config, SessionStore sessionStore, OkHttpClient httpClient) {
        this(config, sessionStore, new GitHubOAuthFlow(config), RestGitHubClient.factory(httpClient, config.getApiEndpoint()));
    }

    public GitHubAuthenticator(GitHubAuthConfig config, SessionStore sessionStore, GitHubOAuthFlow oauthFlow, GitHubClientFactory clientFactory) {
        Objects.requireNonNull(config, "Must provide a configuration for GitHub authentication");
        Objects.requireNonNull(sessionStore, "Must provide a session store for GitHub authentication");
        Objects.requireNonNull(oauthFlow, "Must provide an OAuth flow for GitHub authentication");
        Objects.requireNonNull(clientFactory, "Must provide a GitHub client factory for GitHub authentication");
        TeamMatcher teamMatcher = new TeamMatcher(config.getReadWriteTeams(), config.getReadOnlyTeams());
        this.sessionIndex = new SessionIndex();
        this.oauthFlow = oauthFlow;
        this.loginDance = new LoginDance(clientFactory, teamMatcher, this.sessionIndex, config.getDefaultTeamId());
        this.webhookDispatcher = new WebhookDispatcher(new WebhookSignatureVerifier(config.getWebhookSecret()),
                                                       new WebhookEventDecoder(), this.sessionIndex, sessionStore, teamMatcher);
    }

    /**
     * Decides whether a request may proceed. A logged-in session passes when its access level
     * allows the request method. Otherwise a bearer token is logged in on the spot, and
     * browsers without one are redirected to GitHub.
     * @param request Inbound request
     * @param session Session of the caller
     * @return {@link GateResponse}
     */
    public GateResponse authenticate(GateRequest request, AuthSession session) {
        Objects.requireNonNull(request, "Must provide a request to authenticate");
        Objects.requireNonNull(session, "Must provide a session to authenticate");
        String teamId = session.getString(TEAM_ID);
        if (teamId != null) {
            String method = request.getMethod() == null ? "" : request.getMethod().toUpperCase(Locale.ROOT);
            if (AccessLevel.fromValue(session.get(ACCESS_LEVEL)) != AccessLevel.READ_WRITE && !READ_ONLY_METHODS.contains(method)) {
                log.debug("Refusing {} to read-only session {}", method, session.getId());
                return GateResponse.error(GateResponse.FORBIDDEN);
            }
            return GateResponse.proceed(teamId);
        }

        String authHeader = request.getHeader(AUTHORIZATION);
        if (authHeader == null || authHeader.isEmpty()) { return startBrowserLogin(request, session); }

        AccessToken accessToken;
        try {
            accessToken = getAccessTokenFromHeader(authHeader);
        } catch (MalformedInputException ex) {
            log.debug("Malformed authorization header");
            this.loginDance.cleanupSession(session);
            return GateResponse.error(GateResponse.BAD_REQUEST);
        }
        if (accessToken == null) {
            log.debug("Authorization is not a bearer token");
            this.loginDance.cleanupSession(session);
            return GateResponse.error(GateResponse.UNAUTHORIZED);
        }
        log.debug("Going to do the login dance with a bearer token");
        LoginResult result = this.loginDance.perform(accessToken, session);
        if (result == LoginResult.OK) { return GateResponse.proceed(session.getString(TEAM_ID)); }
        return failedLogin(result, session);
    }

    /**
     * Handles GitHub redirecting the user back after authorizing the application
     * @param request Callback request carrying <code>state</code> and <code>code</code>
     * @param session Session of the caller
     * @return redirect to the originally requested URL, or an error
     */
    public GateResponse handleCallback(GateRequest request, AuthSession session) {
        Objects.requireNonNull(request, "Must provide a callback request");
        Objects.requireNonNull(session, "Must provide a session for the callback");
        String desiredUrl = session.getString(DESIRED_URL);
        if (desiredUrl == null) {
            log.error("Expected to have a valid desiredurl item in session data");
            return internalFailure(session);
        }
        String expectedState = session.getString(STATE);
        if (expectedState == null) {
            log.error("Expected to have a valid state item in session data");
            return internalFailure(session);
        }
        String state = request.getParameter("state");
        if (!expectedState.equals(state)) {
            log.error("Invalid OAuth state, expected {} but got {}", expectedState, state);
            this.loginDance.cleanupSession(session);
            return GateResponse.error(GateResponse.UNAUTHORIZED);
        }
        String code = request.getParameter("code");
        if (code == null || code.isEmpty()) {
            log.error("OAuth callback without an authorization code");
            return internalFailure(session);
        }
        AccessToken accessToken;
        try {
            accessToken = this.oauthFlow.exchangeCode(code);
        } catch (GateAuthenticationException ex) {
            log.error("OAuth exchange failed: {}", ex.getMessage(), ex);
            return internalFailure(session);
        }
        LoginResult result = this.loginDance.perform(accessToken, session);
        if (result == LoginResult.OK) { return GateResponse.redirect(desiredUrl); }
        return failedLogin(result, session);
    }

    /**
     * Handles a GitHub webhook delivery
     * @param request Webhook request
     * @return {@link WebhookResult}
     */
    public WebhookResult handleWebhook(GateRequest request) { return this.webhookDispatcher.dispatch(request); }

    /**
     * Forgets the caller's session and marks it for destruction
     * @param session Session of the caller
     */
    public void cleanupSession(AuthSession session) { this.loginDance.cleanupSession(session); }

    private GateResponse startBrowserLogin(GateRequest request, AuthSession session) {
        State state = GitHubOAuthFlow.generateState();
        session.set(STATE, state.getValue());
        session.set(DESIRED_URL, request.getUrl() == null ? "/" : request.getUrl());
        try {
            session.save();
        } catch (GateAuthenticationException ex) {
            log.error("Failed to save the session before login: {}", ex.getMessage(), ex);
            return GateResponse.error(GateResponse.INTERNAL_SERVER_ERROR);
        }
        log.debug("Starting login with state {}", state.getValue());
        String location = this.oauthFlow.getAuthorizationUri(state).toString();
        log.debug("Redirecting to {}", location);
        return GateResponse.redirect(location);
    }

    /**
     * An unauthorized caller already had their session cleaned up by the login dance
     */
    private GateResponse failedLogin(LoginResult result, AuthSession session) {
        if (result == LoginResult.UNAUTHORIZED) { return GateResponse.error(GateResponse.UNAUTHORIZED); }
        return internalFailure(session);
    }

    private GateResponse internalFailure(AuthSession session) {
        this.loginDance.cleanupSession(session);
        return GateResponse.error(GateResponse.INTERNAL_SERVER_ERROR);
    }

}
