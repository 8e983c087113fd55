package com.acme.corna.security;

import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionTokenServiceTest {
    private static final String SECRET = "unit-test-secret-unit-test-secret-0123456789";

    private final SessionTokenService tokens =
            new SessionTokenService(new SessionProperties(SECRET, "corna-sesh", Duration.ofDays(14), false));

    @Test
    void issuedTokenCarriesCookieId() {
        String token = tokens.issue("cookie-123", Instant.now().plus(Duration.ofHours(1)));
        assertThat(tokens.cookieId(token)).isEqualTo("cookie-123");
    }

    @Test
    void expiredTokenRejected() {
        String token = tokens.issue("cookie-123", Instant.now().minus(Duration.ofMinutes(5)));
        assertThatThrownBy(() -> tokens.cookieId(token)).isInstanceOf(JwtException.class);
    }

    @Test
    void tokenSignedWithOtherSecretRejected() {
        SessionTokenService other = new SessionTokenService(
                new SessionProperties("another-secret-another-secret-0123456789", "corna-sesh", Duration.ofDays(14), false));
        String token = other.issue("cookie-123", Instant.now().plus(Duration.ofHours(1)));
        assertThatThrownBy(() -> tokens.cookieId(token)).isInstanceOf(JwtException.class);
    }
}
