package com.helia.auth;

import com.helia.config.AuthProperties;
import com.helia.error.ChatException;
import com.helia.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import reactor.test.StepVerifier;

class HeaderAuthenticatorTest {

    private AuthProperties properties;
    private HeaderAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        properties = new AuthProperties();
        properties.getTokens().put("token-alice", "alice");
        authenticator = new HeaderAuthenticator(properties);
    }

    @Test
    void knownBearerTokenWins() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/api/sessions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer token-alice")
                .header("X-User-Id", "bob")
                .build();

        StepVerifier.create(authenticator.identify(request))
                .expectNext("alice")
                .verifyComplete();
    }

    @Test
    void unknownBearerTokenIsRejectedEvenWithHeader() {
        MockServerHttpRequest request = MockServerHttpRequest.get("/api/sessions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer forged")
                .header("X-User-Id", "alice")
                .build();

        StepVerifier.create(authenticator.identify(request))
                .expectErrorMatches(ex -> ex instanceof ChatException c && c.code() == ErrorCode.UNAUTHORIZED)
                .verify();
    }

    @Test
    void trustedHeaderIdentifiesCaller() {
        StepVerifier.create(authenticator.identify(new RequestCredentials(null, " carol ")))
                .expectNext("carol")
                .verifyComplete();
    }

    @Test
    void headerIgnoredWhenNotTrusted() {
        properties.setTrustUserHeader(false);

        StepVerifier.create(authenticator.identify(new RequestCredentials(null, "carol")))
                .expectErrorMatches(ex -> ex instanceof ChatException c && c.code() == ErrorCode.UNAUTHORIZED)
                .verify();
    }

    @Test
    void missingCredentialsAreUnauthorized() {
        StepVerifier.create(authenticator.identify(new RequestCredentials("Basic abc", null)))
                .expectErrorMatches(ex -> ex instanceof ChatException c && c.code() == ErrorCode.UNAUTHORIZED)
                .verify();
    }
}
