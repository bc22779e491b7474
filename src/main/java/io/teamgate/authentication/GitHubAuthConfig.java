package io.teamgate.authentication;

import lombok.Getter;
import lombok.NoArgsConstructor;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of the GitHub authenticator. Must use {@link Builder} for creation.
 */
@Getter
public class GitHubAuthConfig {

    private static final String GITHUB_WEB = "https://github.com";
    private static final String GITHUB_API = "https://api.github.com";

    private final String enterpriseUrl;
    /** Signing key of the host's session cookies. Carried for the host's session codec; the gate never reads it. */
    private final byte[] sessionAuthKey;
    /** Encryption key of the host's session cookies, optional. Carried for the host's session codec like {@link #sessionAuthKey}. */
    private final byte[] sessionCryptKey;
    private final String oauthClientId;
    private final String oauthClientSecret;
    private final String webhookSecret;
    private final List<String> readWriteTeams;
    private final List<String> readOnlyTeams;
    private final String defaultTeamId;
    private final URI redirectUri;

    private GitHubAuthConfig(Builder builder) {
        Objects.requireNonNull(builder.oauthClientId, "Must provide an OAuth client identifier to configure GitHub authentication");
        Objects.requireNonNull(builder.oauthClientSecret, "Must provide an OAuth client secret to configure GitHub authentication");
        Objects.requireNonNull(builder.webhookSecret, "Must provide a webhook secret to configure GitHub authentication");
        Objects.requireNonNull(builder.defaultTeamId, "Must provide a default team identifier to configure GitHub authentication");
        this.enterpriseUrl = stripTrailingSlash(builder.enterpriseUrl == null ? "" : builder.enterpriseUrl.trim());
        this.sessionAuthKey = builder.sessionAuthKey == null ? null : builder.sessionAuthKey.clone();
        this.sessionCryptKey = builder.sessionCryptKey == null ? null : builder.sessionCryptKey.clone();
        this.oauthClientId = builder.oauthClientId;
        this.oauthClientSecret = builder.oauthClientSecret;
        this.webhookSecret = builder.webhookSecret;
        this.readWriteTeams = List.copyOf(builder.readWriteTeams);
        this.readOnlyTeams = List.copyOf(builder.readOnlyTeams);
        this.defaultTeamId = builder.defaultTeamId;
        this.redirectUri = builder.redirectUri;
    }

    public boolean isEnterprise() { return !this.enterpriseUrl.isEmpty(); }

    public URI getAuthorizationEndpoint() { return URI.create(getWebRoot() + "/login/oauth/authorize"); }

    public URI getTokenEndpoint() { return URI.create(getWebRoot() + "/login/oauth/access_token"); }

    public URI getApiEndpoint() { return URI.create(isEnterprise() ? this.enterpriseUrl + "/api/v3" : GITHUB_API); }

    private String getWebRoot() { return isEnterprise() ? this.enterpriseUrl : GITHUB_WEB; }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Builder for {@link GitHubAuthConfig} instances. The OAuth client identifier and secret,
     * the webhook secret and the default team identifier are required.
     */
    @NoArgsConstructor
    public static class Builder {

        private String enterpriseUrl;
        private byte[] sessionAuthKey;
        private byte[] sessionCryptKey;
        private String oauthClientId;
        private String oauthClientSecret;
        private String webhookSecret;
        private final List<String> readWriteTeams = new ArrayList<>();
        private final List<String> readOnlyTeams = new ArrayList<>();
        private String defaultTeamId;
        private URI redirectUri;

        /**
         * Sets the base URL of a GitHub Enterprise instance. Empty means github.com.
         * @param enterpriseUrl Base URL of the enterprise instance
         * @return GitHubAuthConfig.Builder
         */
        public Builder setEnterpriseUrl(String enterpriseUrl) {
            this.enterpriseUrl = enterpriseUrl;
            return this;
        }

        /**
         * Sets the keys the host's session store signs and encrypts session cookies with. They are
         * only passed through to the host through {@link GitHubAuthConfig#getSessionAuthKey()} and
         * {@link GitHubAuthConfig#getSessionCryptKey()}.
         * @param authKey Signing key
         * @param cryptKey Encryption key
         * @return GitHubAuthConfig.Builder
         */
        public Builder setSessionKeys(byte[] authKey, byte[] cryptKey) {
            Objects.requireNonNull(authKey, "Must provide a session signing key");
            this.sessionAuthKey = authKey.clone();
            this.sessionCryptKey = cryptKey == null ? null : cryptKey.clone();
            return this;
        }

        public Builder setOAuthClient(String clientId, String clientSecret) {
            Objects.requireNonNull(clientId, "Must provide an OAuth client identifier");
            Objects.requireNonNull(clientSecret, "Must provide an OAuth client secret");
            this.oauthClientId = clientId;
            this.oauthClientSecret = clientSecret;
            return this;
        }

        public Builder setWebhookSecret(String webhookSecret) {
            Objects.requireNonNull(webhookSecret, "Must provide a webhook secret");
            this.webhookSecret = webhookSecret;
            return this;
        }

        /**
         * Adds entries granting read-write access. Each is either <code>org/team</code>
         * or a bare <code>org</code> matching organization membership.
         * @param teams Team names
         * @return GitHubAuthConfig.Builder
         */
        public Builder addReadWriteTeams(List<String> teams) {
            Objects.requireNonNull(teams, "Must provide read-write teams");
            this.readWriteTeams.addAll(teams);
            return this;
        }

        /**
         * Adds entries granting read-only access, in the same form as
         * {@link #addReadWriteTeams(List)}
         * @param teams Team names
         * @return GitHubAuthConfig.Builder
         */
        public Builder addReadOnlyTeams(List<String> teams) {
            Objects.requireNonNull(teams, "Must provide read-only teams");
            this.readOnlyTeams.addAll(teams);
            return this;
        }

        public Builder setDefaultTeamId(String defaultTeamId) {
            Objects.requireNonNull(defaultTeamId, "Must provide a default team identifier");
            this.defaultTeamId = defaultTeamId;
            return this;
        }

        /**
         * Sets the redirect URI sent with authorization requests. When unset GitHub uses the
         * callback URL registered for the OAuth application.
         * @param redirectUri Callback URI
         * @return GitHubAuthConfig.Builder
         */
        public Builder setRedirectUri(URI redirectUri) {
            this.redirectUri = redirectUri;
            return this;
        }

        public GitHubAuthConfig build() { return new GitHubAuthConfig(this); }

    }

}
