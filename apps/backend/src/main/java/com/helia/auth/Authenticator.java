package com.helia.auth;

import org.springframework.http.server.reactive.ServerHttpRequest;
import reactor.core.publisher.Mono;

/**
 * Resolves a request to the owner id every session operation is scoped by.
 * Fails with {@code UNAUTHORIZED} when no identity can be established.
 */
public interface Authenticator {

    Mono<String> identify(RequestCredentials credentials);

    Mono<String> identify(ServerHttpRequest request);
}
