package com.biblioteca.backend.modules.auth.application;

import com.biblioteca.backend.global.security.JwtAuthenticationPrincipal;
import com.biblioteca.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.biblioteca.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns a bearer token into a principal. The account is reloaded on every request so that
 * deactivation and role changes apply immediately instead of at token expiry.
 */
@Service
public class TokenAuthenticationService {

    private final JwtTokenService jwtTokenService;
    private final LibraryUserRepository libraryUserRepository;

    public TokenAuthenticationService(JwtTokenService jwtTokenService, LibraryUserRepository libraryUserRepository) {
        this.jwtTokenService = jwtTokenService;
        this.libraryUserRepository = libraryUserRepository;
    }

    @Transactional(readOnly = true)
    public JwtAuthenticationPrincipal authenticate(String token) {
        ParsedToken parsed = jwtTokenService.parseAccessToken(token);
        LibraryUser user = libraryUserRepository.findByIdAndActiveTrue(parsed.userId())
                .orElseThrow(() -> new InvalidTokenException("User missing or inactive: " + parsed.userId(), null));
        return new JwtAuthenticationPrincipal(user.getId(), user.getEmail(), user.getRole());
    }
}
