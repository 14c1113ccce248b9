package org.readacademy.engine.store;

import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.Objects;

/**
 * Adds the backend API key to every store call, both as {@code apikey} and as a Bearer token.
 */
public class AuthInterceptor implements Interceptor {

    private final String apiKey;

    public AuthInterceptor(String apiKey) {
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request original = chain.request();
        Request.Builder builder = original.newBuilder()
                .header("apikey", apiKey)
                .header("Authorization", "Bearer " + apiKey);

        return chain.proceed(builder.build());
    }
}
