package com.biblioteca.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.biblioteca.backend.modules.auth.application.JwtTokenService;
import com.biblioteca.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.biblioteca.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.biblioteca.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.domain.UserRole;
import com.biblioteca.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-secret-for-biblioteca-tokens-0123456789";
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T10:00:00Z");

    private JwtTokenProvider tokenProvider;
    private LibraryUser user;

    @BeforeEach
    void setUp() {
        tokenProvider = new JwtTokenProvider(SECRET);
        user = new LibraryUser();
        user.setEmail("carlos@example.com");
        user.setRole(UserRole.BIBLIOTECARIO);
        try {
            java.lang.reflect.Field idField = LibraryUser.class.getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(user, 42L);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }

    @Test
    void issuedTokenCarriesIdentityClaims() {
        JwtTokenService service = serviceAt(NOW, 86_400_000L);

        IssuedToken issued = service.issueToken(user);
        ParsedToken parsed = service.parseAccessToken(issued.token());

        assertThat(issued.expiresInSeconds()).isEqualTo(86_400L);
        assertThat(parsed.userId()).isEqualTo(42L);
        assertThat(parsed.email()).isEqualTo("carlos@example.com");
        assertThat(parsed.role()).isEqualTo(UserRole.BIBLIOTECARIO);
        assertThat(parsed.expiresAt()).isEqualTo(NOW.plusDays(1));
    }

    @Test
    void expiredTokenIsRejected() {
        String token = serviceAt(NOW, 300_000L).issueToken(user).token();

        JwtTokenService later = serviceAt(NOW.plus(Duration.ofMinutes(10)), 300_000L);

        assertThrows(InvalidTokenException.class, () -> later.parseAccessToken(token));
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        JwtTokenService foreign = new JwtTokenService(
                new JwtTokenProvider("another-secret-that-is-long-enough-for-hs256-keys"),
                86_400_000L,
                fixedClock(NOW)
        );
        String token = foreign.issueToken(user).token();

        assertThrows(InvalidTokenException.class, () -> serviceAt(NOW, 86_400_000L).parseAccessToken(token));
    }

    @Test
    void malformedTokenIsRejected() {
        assertThrows(InvalidTokenException.class, () -> serviceAt(NOW, 86_400_000L).parseAccessToken("not-a-jwt"));
    }

    private JwtTokenService serviceAt(OffsetDateTime now, long ttlMillis) {
        return new JwtTokenService(tokenProvider, ttlMillis, fixedClock(now));
    }

    private static Clock fixedClock(OffsetDateTime now) {
        return Clock.fixed(now.toInstant(), ZoneOffset.UTC);
    }
}
