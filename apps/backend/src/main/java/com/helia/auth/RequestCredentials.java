package com.helia.auth;

import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;

/**
 * What the caller presented: the raw Authorization header and the gateway identity header.
 */
public record RequestCredentials(String authorization, String forwardedUser) {

    public static RequestCredentials from(ServerHttpRequest request, String userHeader) {
        HttpHeaders headers = request.getHeaders();
        return new RequestCredentials(headers.getFirst(HttpHeaders.AUTHORIZATION), headers.getFirst(userHeader));
    }

    public String bearerToken() {
        if (authorization == null || !authorization.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return null;
        }
        String token = authorization.substring(7).trim();
        return token.isEmpty() ? null : token;
    }
}
