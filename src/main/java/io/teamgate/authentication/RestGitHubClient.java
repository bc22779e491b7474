package io.teamgate.authentication;

import com.nimbusds.oauth2.sdk.ParseException;
import com.nimbusds.oauth2.sdk.util.JSONArrayUtils;
import com.nimbusds.oauth2.sdk.util.JSONObjectUtils;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.teamgate.authentication.GitHubAuthHelper.*;

/**
 * {@link GitHubClient} backed by the GitHub REST API, using an OkHttp client that presents
 * the user's access token through an {@link AccessTokenInterceptor}. Listings are fetched
 * one page at a time, following the <code>next</code> relation of the Link header.
 */
@Slf4j
public class RestGitHubClient implements GitHubClient {

    public static final int PAGE_SIZE = 50;
    private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"next\"");

    private final OkHttpClient httpClient;
    private final HttpUrl apiEndpoint;

    /**
     * Construct a new RestGitHubClient
     * @param httpClient Base OkHttp client (its connection pool and timeouts are shared)
     * @param apiEndpoint Root of the GitHub REST API
     * @param accessToken {@link AccessToken} of the user
     */
    public RestGitHubClient(OkHttpClient httpClient, URI apiEndpoint, AccessToken accessToken) {
        Objects.requireNonNull(httpClient, "Must provide an http client to query GitHub");
        Objects.requireNonNull(apiEndpoint, "Must provide the GitHub API endpoint");
        Objects.requireNonNull(accessToken, "Must provide an access token to query GitHub");
        this.httpClient = httpClient.newBuilder().addInterceptor(new AccessTokenInterceptor(accessToken)).build();
        this.apiEndpoint = HttpUrl.get(apiEndpoint.toString());
    }

    /**
     * Provides a {@link GitHubClientFactory} that creates clients sharing <code>httpClient</code>
     * @param httpClient Base OkHttp client
     * @param apiEndpoint Root of the GitHub REST API
     * @return GitHubClientFactory
     */
    public static GitHubClientFactory factory(OkHttpClient httpClient, URI apiEndpoint) {
        Objects.requireNonNull(httpClient, "Must provide an http client to query GitHub");
        Objects.requireNonNull(apiEndpoint, "Must provide the GitHub API endpoint");
        return accessToken -> new RestGitHubClient(httpClient, apiEndpoint, accessToken);
    }

    @Override
    public String getAuthenticatedLogin() throws GateAuthenticationException {
        HttpUrl url = this.apiEndpoint.newBuilder().addPathSegment("user").build();
        try (Response response = get(url)) {
            Map<String, Object> user = JSONObjectUtils.parse(getBody(response));
            return getString(user, "login");
        } catch (IOException | ParseException ex) {
            throw new GateAuthenticationException("Failed to get authenticated user from " + url, ex);
        }
    }

    @Override
    public PagedResults<GitHubTeam> listUserTeams() {
        return new LinkedPages<>(firstPage("user/teams"), item -> new GitHubTeam(getString(item, "name"), getString(item, "organization", "login")));
    }

    @Override
    public PagedResults<String> listUserOrganizations() {
        return new LinkedPages<>(firstPage("user/orgs"), item -> getString(item, "login"));
    }

    private HttpUrl firstPage(String path) {
        return this.apiEndpoint.newBuilder()
                               .addPathSegments(path)
                               .addQueryParameter("per_page", String.valueOf(PAGE_SIZE))
                               .addQueryParameter("page", "1")
                               .build();
    }

    private Response get(HttpUrl url) throws IOException, InvalidTokenException {
        Request request = new Request.Builder().url(url).header(ACCEPT, GITHUB_JSON).get().build();
        Response response = this.httpClient.newCall(request).execute();
        if (response.code() == 401) {
            response.close();
            throw new InvalidTokenException("GitHub rejected the access token for " + url);
        }
        if (!response.isSuccessful()) {
            response.close();
            throw new IOException("Request failed to " + url + " with status " + response.code());
        }
        return response;
    }

    private static String getBody(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) { throw new IOException("Empty response from " + response.request().url()); }
        return body.string();
    }

    /**
     * Gets the next page from the Link header of a listing response
     * @param response OkHttp Response
     * @return URL of the next page or null on the last page
     */
    protected static HttpUrl getNextPage(Response response) {
        String link = response.header("Link");
        if (link == null) { return null; }
        Matcher matcher = NEXT_LINK.matcher(link);
        if (!matcher.find()) { return null; }
        return HttpUrl.parse(matcher.group(1));
    }

    /**
     * The access token is attached to every request, so pages are only followed on the API host
     */
    private HttpUrl sameHost(HttpUrl nextPage) {
        if (nextPage == null || nextPage.host().equals(this.apiEndpoint.host())) { return nextPage; }
        log.warn("Not following next page on foreign host {}", nextPage.host());
        return null;
    }

    private class LinkedPages<T> implements PagedResults<T> {

        private final Function<Object, T> mapper;
        private HttpUrl nextPage;

        LinkedPages(HttpUrl firstPage, Function<Object, T> mapper) {
            this.nextPage = firstPage;
            this.mapper = mapper;
        }

        @Override
        public boolean hasNext() { return this.nextPage != null; }

        @Override
        public List<T> next() throws GateAuthenticationException {
            if (this.nextPage == null) { throw new IllegalStateException("No further page to fetch"); }
            HttpUrl url = this.nextPage;
            try (Response response = get(url)) {
                List<Object> items = JSONArrayUtils.parse(getBody(response));
                this.nextPage = sameHost(getNextPage(response));
                log.debug("Fetched {} items from {}", items.size(), url);
                List<T> page = new ArrayList<>(items.size());
                for (Object item : items) { page.add(this.mapper.apply(item)); }
                return page;
            } catch (IOException | ParseException ex) {
                throw new GateAuthenticationException("Failed to list " + url, ex);
            }
        }

    }

}
