package com.acme.corna.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

/**
 * Signs and verifies the value of the session cookie. The token only carries the
 * cookie id; the session row it points at decides who is logged in.
 */
@Service
public class SessionTokenService {
    private final SessionProperties props;

    public SessionTokenService(SessionProperties props) {
        this.props = props;
    }

    public String issue(String cookieId, Instant expiresAt) {
        return Jwts.builder()
                .subject(cookieId)
                .issuedAt(new Date())
                .expiration(Date.from(expiresAt))
                .signWith(key(), Jwts.SIG.HS256)
                .compact();
    }

    /**
     * @throws io.jsonwebtoken.JwtException if the token is forged, malformed or expired
     */
    public String cookieId(String token) {
        return Jwts.parser().verifyWith(key()).build().parseSignedClaims(token).getPayload().getSubject();
    }

    private SecretKey key() {
        return Keys.hmacShaKeyFor(props.secret().getBytes(StandardCharsets.UTF_8));
    }
}
