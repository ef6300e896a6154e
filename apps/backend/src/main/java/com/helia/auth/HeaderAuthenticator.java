package com.helia.auth;

import com.helia.config.AuthProperties;
import com.helia.error.ChatException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/**
 * Accepts a bearer token listed in {@code helia.auth.tokens}, or, when enabled, the user id
 * header set by an upstream gateway. A presented but unknown bearer token is rejected even
 * if the header is present.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HeaderAuthenticator implements Authenticator {

    private final AuthProperties properties;

    @Override
    public Mono<String> identify(ServerHttpRequest request) {
        return identify(RequestCredentials.from(request, properties.getUserHeader()));
    }

    @Override
    public Mono<String> identify(RequestCredentials credentials) {
        return Mono.fromSupplier(() -> resolve(credentials));
    }

    private String resolve(RequestCredentials credentials) {
        String token = credentials.bearerToken();
        if (token != null) {
            String owner = properties.getTokens().get(token);
            if (owner == null) {
                log.debug("Rejected unknown bearer token");
                throw ChatException.unauthorized();
            }
            return owner;
        }
        if (properties.isTrustUserHeader() && StringUtils.hasText(credentials.forwardedUser())) {
            return credentials.forwardedUser().trim();
        }
        throw ChatException.unauthorized();
    }
}
