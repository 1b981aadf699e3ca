package com.edudata.authservice.SecurityConfig;

import com.edudata.authservice.config.AuthProperties;
import com.edudata.authservice.entity.UserRole;
import com.edudata.authservice.model.SessionClaims;
import com.edudata.authservice.service.SessionTokenIssuer;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * HS256 session tokens. Verification is signature + expiry (+ issuer when configured),
 * so a token stays valid until it expires; there is no server-side revocation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtTokenProviderConfig implements SessionTokenIssuer {

    static final String ROLE_CLAIM = "role";

    private final AuthProperties properties;
    private final Clock clock;

    /** Cached signing key & parser for performance */
    private SecretKey signingKey;
    private JwtParser jwtParser;
    private Duration tokenTtl;
    private String issuerOpt;

    @PostConstruct
    void init() {
        String secret = properties.getSession().getSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("Session token secret must be provided (base64, SESSION_TOKEN_SECRET).");
        }
        final byte[] keyBytes;
        try {
            keyBytes = Decoders.BASE64.decode(secret.trim());
        } catch (RuntimeException e) {
            throw new IllegalStateException("Session token secret must be valid Base64.", e);
        }
        // HS256 requires >= 256-bit (32 bytes) key
        if (keyBytes.length < 32) {
            throw new IllegalStateException("Session token secret too short for HS256. Provide >= 256-bit Base64 key.");
        }

        signingKey = Keys.hmacShaKeyFor(keyBytes);
        tokenTtl = properties.getSession().getTokenTtl();
        issuerOpt = properties.getSession().getIssuer();

        var parserBuilder = Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .clockSkewSeconds(30); // tolerate small clock drift

        if (issuerOpt != null && !issuerOpt.isBlank()) {
            parserBuilder = parserBuilder.requireIssuer(issuerOpt);
        }
        jwtParser = parserBuilder.build();
    }

    @Override
    public String issue(UUID userId, UserRole role) {
        Instant now = clock.instant();
        Instant expiration = now.plus(tokenTtl);

        var builder = Jwts.builder()
                .subject(userId.toString())
                .claim(ROLE_CLAIM, role.name())
                .id(UUID.randomUUID().toString().replace("-", ""))
                .issuedAt(Date.from(now))
                .notBefore(Date.from(now))
                .expiration(Date.from(expiration));

        if (issuerOpt != null && !issuerOpt.isBlank()) {
            builder = builder.issuer(issuerOpt);
        }
        return builder
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    @Override
    public Optional<SessionClaims> verify(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        try {
            Claims claims = jwtParser.parseSignedClaims(token).getPayload();
            UUID userId = UUID.fromString(claims.getSubject());
            UserRole role = UserRole.valueOf(claims.get(ROLE_CLAIM, String.class));
            return Optional.of(new SessionClaims(
                    userId,
                    role,
                    claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null,
                    claims.getExpiration() != null ? claims.getExpiration().toInstant() : null));
        } catch (JwtException | IllegalArgumentException | NullPointerException e) {
            log.debug("Rejected session token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public long getTokenValiditySeconds() {
        return tokenTtl.toSeconds();
    }
}
