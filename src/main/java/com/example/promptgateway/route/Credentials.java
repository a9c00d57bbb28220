package com.example.promptgateway.route;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;

final class Credentials {
    static final String X_API_KEY = "x-api-key";
    private static final String BEARER = "Bearer ";

    private Credentials() {
    }

    static String bearerToken(HttpHeaders headers) {
        String authorization = headers.get(HttpHeaderNames.AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return authorization.substring(BEARER.length()).trim();
        }
        return null;
    }

    /**
     * Bearer token, falling back to the x-api-key header used by Anthropic clients.
     */
    static String clientToken(HttpHeaders headers) {
        String token = bearerToken(headers);
        return token != null ? token : headers.get(X_API_KEY);
    }
}
