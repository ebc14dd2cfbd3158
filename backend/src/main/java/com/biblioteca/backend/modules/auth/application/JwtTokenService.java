package com.biblioteca.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;

import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.domain.UserRole;
import com.biblioteca.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    public static final String CLAIM_EMAIL = "correo";
    public static final String CLAIM_ROLE = "rol";
    public static final String CLAIM_USER_ID = "userId";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:86400000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public IssuedToken issueToken(LibraryUser user) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(accessTokenTtlMillis);

        SecretKey key = tokenProvider.getSecretKey();

        String token = Jwts.builder()
                .subject(user.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_ROLE, user.getRole().getCode())
                .claim(CLAIM_USER_ID, user.getId())
                .signWith(key, SIG.HS256)
                .compact();

        return new IssuedToken(
                token,
                accessTokenTtlMillis / 1000L,
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            Object userIdClaim = claims.get(CLAIM_USER_ID);
            if (!(userIdClaim instanceof Number userIdNumber)) {
                throw new InvalidTokenException("Token without userId claim", null);
            }
            String email = claims.get(CLAIM_EMAIL, String.class);
            String roleCode = claims.get(CLAIM_ROLE, String.class);
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    userIdNumber.longValue(),
                    email,
                    roleCode == null ? null : UserRole.fromCode(roleCode),
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record IssuedToken(String token, long expiresInSeconds, OffsetDateTime issuedAt) {
    }

    public record ParsedToken(Long userId, String email, UserRole role, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
