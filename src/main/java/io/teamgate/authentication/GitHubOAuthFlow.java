package io.teamgate.authentication;

import com.nimbusds.oauth2.sdk.*;
import com.nimbusds.oauth2.sdk.auth.ClientAuthentication;
import com.nimbusds.oauth2.sdk.auth.ClientSecretPost;
import com.nimbusds.oauth2.sdk.auth.Secret;
import com.nimbusds.oauth2.sdk.http.HTTPRequest;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.token.BearerAccessToken;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;

import static io.teamgate.authentication.GitHubAuthHelper.translateAccessToken;

/**
 * The browser side of GitHub's OAuth web application flow: builds the authorization
 * request users are redirected to and exchanges the returned code for an access token.
 * Requests the <code>read:org</code> scope, which covers listing the user's teams and
 * organizations.
 */
public class GitHubOAuthFlow {

    public static final Scope SCOPE = new Scope("read:org");
    /** Length of the random state, 48 bytes giving 64 characters once encoded */
    private static final int STATE_BYTE_LENGTH = 48;

    private final ClientID clientId;
    private final Secret clientSecret;
    private final URI authorizationEndpoint;
    private final URI tokenEndpoint;
    private final URI redirectUri;

    public GitHubOAuthFlow(GitHubAuthConfig config) {
        Objects.requireNonNull(config, "Must provide a configuration for the OAuth flow");
        this.clientId = new ClientID(config.getOauthClientId());
        this.clientSecret = new Secret(config.getOauthClientSecret());
        this.authorizationEndpoint = config.getAuthorizationEndpoint();
        this.tokenEndpoint = config.getTokenEndpoint();
        this.redirectUri = config.getRedirectUri();
    }

    /**
     * Generates a new random state to protect an authorization request against CSRF
     * @return State
     */
    public static State generateState() { return new State(STATE_BYTE_LENGTH); }

    /**
     * Builds the URI of the authorization request that the user should be redirected to
     * @param state State that the callback must return
     * @return URI of the authorization request
     */
    public URI getAuthorizationUri(State state) {
        Objects.requireNonNull(state, "Must provide a state for the authorization request");
        AuthorizationRequest.Builder requestBuilder = new AuthorizationRequest.Builder(new ResponseType(ResponseType.Value.CODE), this.clientId);
        requestBuilder.scope(SCOPE)
                      .state(state)
                      .customParameter("access_type", "online")
                      .endpointURI(this.authorizationEndpoint);
        if (this.redirectUri != null) { requestBuilder.redirectionURI(this.redirectUri); }
        return requestBuilder.build().toURI();
    }

    /**
     * Exchanges an authorization code for an access token at GitHub's token endpoint
     * @param code Authorization code received on the callback
     * @return {@link AccessToken}
     * @throws GateAuthenticationException if the exchange fails or yields no bearer token
     */
    public AccessToken exchangeCode(String code) throws GateAuthenticationException {
        Objects.requireNonNull(code, "Must provide an authorization code to exchange");
        AuthorizationGrant codeGrant = new AuthorizationCodeGrant(new AuthorizationCode(code), this.redirectUri);
        ClientAuthentication clientAuth = new ClientSecretPost(this.clientId, this.clientSecret);
        TokenRequest request = new TokenRequest(this.tokenEndpoint, clientAuth, codeGrant);
        HTTPRequest httpRequest = request.toHTTPRequest();
        // GitHub answers with a form-encoded body unless asked for JSON
        httpRequest.setAccept("application/json");
        TokenResponse response;
        try {
            response = TokenResponse.parse(httpRequest.send());
            if (!response.indicatesSuccess()) { throw new IOException(response.toErrorResponse().getErrorObject().toString()); }
        } catch (IOException | ParseException ex) {
            throw new GateAuthenticationException("Request failed to token endpoint " + this.tokenEndpoint, ex);
        }
        BearerAccessToken token = response.toSuccessResponse().getTokens().getBearerAccessToken();
        if (token == null) { throw new GateAuthenticationException("Access token is not a bearer token"); }
        return translateAccessToken(token);
    }

}
