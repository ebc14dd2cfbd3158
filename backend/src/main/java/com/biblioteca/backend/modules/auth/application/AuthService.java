package com.biblioteca.backend.modules.auth.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.biblioteca.backend.global.error.FieldValidationException;
import com.biblioteca.backend.global.error.ProblemException;
import com.biblioteca.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.domain.UserRole;
import com.biblioteca.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.biblioteca.backend.modules.auth.presentation.dto.LoginRequest;
import com.biblioteca.backend.modules.auth.presentation.dto.LoginResponse;
import com.biblioteca.backend.modules.auth.presentation.dto.RegisterRequest;
import com.biblioteca.backend.modules.auth.presentation.dto.RegisterResponse;
import com.biblioteca.backend.modules.auth.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String MESSAGE_REGISTERED = "Usuario registrado exitosamente";

    private final LibraryUserRepository libraryUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;

    public AuthService(
            LibraryUserRepository libraryUserRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            Clock clock
    ) {
        this.libraryUserRepository = libraryUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
    }

    public RegisterResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.correo());
        String identityNumber = request.numeroIdentidad().trim();

        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (libraryUserRepository.existsByEmailIgnoreCase(email)) {
            errors.computeIfAbsent("correo", key -> new ArrayList<>()).add("Este correo ya está registrado");
        }
        if (libraryUserRepository.existsByIdentityNumber(identityNumber)) {
            errors.computeIfAbsent("numeroIdentidad", key -> new ArrayList<>()).add("Este número de identidad ya existe");
        }
        if (!errors.isEmpty()) {
            throw new FieldValidationException(errors);
        }

        LibraryUser user = new LibraryUser();
        user.setFirstName(request.nombre().trim());
        user.setLastName(request.apellido().trim());
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setAge(request.edad());
        user.setIdentityNumber(identityNumber);
        user.setPhone(request.telefono().trim());
        user.setRole(UserRole.USUARIO);
        user.setActive(true);
        user.setFines(BigDecimal.ZERO.setScale(2));
        user.setRegisteredAt(OffsetDateTime.now(clock));
        LibraryUser saved = libraryUserRepository.save(user);

        log.info("Registered user id={} email={}", saved.getId(), saved.getEmail());
        return new RegisterResponse(MESSAGE_REGISTERED, UserResponse.from(saved));
    }

    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        LibraryUser user = libraryUserRepository.findByEmailIgnoreCase(normalizeEmail(request.correo()))
                .orElseThrow(() -> {
                    log.warn("Login rejected: unknown email");
                    return invalidCredentials();
                });

        if (!user.isActive()) {
            log.warn("Login rejected: inactive account id={}", user.getId());
            throw new ProblemException(HttpStatus.FORBIDDEN, "auth.user_inactive", "Cuenta inactiva. Contacte al administrador.");
        }

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            log.warn("Login rejected: bad password for id={}", user.getId());
            throw invalidCredentials();
        }

        IssuedToken issued = jwtTokenService.issueToken(user);
        return new LoginResponse(
                issued.token(),
                LoginResponse.DEFAULT_TOKEN_TYPE,
                issued.expiresInSeconds(),
                issued.issuedAt(),
                UserResponse.from(user)
        );
    }

    @Transactional(readOnly = true)
    public UserResponse loadProfile(Long userId) {
        LibraryUser user = libraryUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "auth.user_not_found", "Usuario no encontrado"));
        return UserResponse.from(user);
    }

    private ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_credentials", "Correo o contraseña incorrectos");
    }

    static String normalizeEmail(String raw) {
        return raw == null ? null : raw.trim().toLowerCase(Locale.ROOT);
    }
}
