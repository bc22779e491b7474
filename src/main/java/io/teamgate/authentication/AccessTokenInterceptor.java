package io.teamgate.authentication;

import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.Objects;

import static io.teamgate.authentication.GitHubAuthHelper.AUTHORIZATION;

/**
 * Leverages the OkHttp
 * <a href="https://square.github.io/okhttp/features/interceptors/">Interceptor API</a>
 * to present the access token of the user on whose behalf the gate queries GitHub. Requests
 * that already carry an Authorization header are left untouched.
 */
public class AccessTokenInterceptor implements Interceptor {

    private final AccessToken accessToken;

    /**
     * Construct a new AccessTokenInterceptor
     * @param accessToken {@link AccessToken} to present on each request
     */
    public AccessTokenInterceptor(AccessToken accessToken) {
        Objects.requireNonNull(accessToken, "Must supply an access token for the access token interceptor");
        this.accessToken = accessToken;
    }

    @NotNull
    @Override
    public Response intercept(@NotNull Chain chain) throws IOException {
        Request request = chain.request();
        if (request.header(AUTHORIZATION) != null) { return chain.proceed(request); }
        return chain.proceed(request.newBuilder().header(AUTHORIZATION, "Bearer " + this.accessToken.getValue()).build());
    }

}
