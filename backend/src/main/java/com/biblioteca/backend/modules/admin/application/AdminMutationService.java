package com.biblioteca.backend.modules.admin.application;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.biblioteca.backend.global.error.FieldValidationException;
import com.biblioteca.backend.global.error.ProblemException;
import com.biblioteca.backend.modules.admin.domain.FineAction;
import com.biblioteca.backend.modules.admin.presentation.dto.FineUpdateResponse;
import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.domain.UserRole;
import com.biblioteca.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.biblioteca.backend.modules.auth.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AdminMutationService {

    private static final Logger log = LoggerFactory.getLogger(AdminMutationService.class);

    private final LibraryUserRepository libraryUserRepository;

    public AdminMutationService(LibraryUserRepository libraryUserRepository) {
        this.libraryUserRepository = libraryUserRepository;
    }

    public UserResponse changeRole(@NonNull Long targetUserId, @NonNull Long actorUserId, String roleCode) {
        UserRole role = parseRole(roleCode);
        LibraryUser target = findUser(targetUserId);
        if (target.getId().equals(actorUserId) && role != target.getRole()) {
            throw new ProblemException(HttpStatus.CONFLICT, "admin.self_role_change", "No puede cambiar su propio rol");
        }
        UserRole previous = target.getRole();
        target.setRole(role);
        log.info("User id={} role changed {} -> {} by admin={}", target.getId(), previous.getCode(), role.getCode(), actorUserId);
        return UserResponse.from(target);
    }

    /**
     * Applies a fine operation. Amounts are kept with two decimals and the balance never goes negative.
     */
    public FineUpdateResponse manageFine(@NonNull Long targetUserId, @NonNull Long actorUserId, String actionCode, BigDecimal amount) {
        FineAction action = parseAction(actionCode);
        LibraryUser target = findUser(targetUserId);
        BigDecimal normalized = amount.setScale(2, RoundingMode.HALF_UP);
        BigDecimal previous = target.getFines();

        switch (action) {
            case PAGAR -> {
                if (normalized.compareTo(previous) > 0) {
                    throw FieldValidationException.of("monto",
                            "El pago (" + normalized + ") excede las multas pendientes (" + previous + ")");
                }
                target.setFines(previous.subtract(normalized));
            }
            case AGREGAR -> target.setFines(previous.add(normalized));
            case ESTABLECER -> target.setFines(normalized);
        }

        log.info("User id={} fines {} {} ({} -> {}) by staff={}", target.getId(), action.getCode(), normalized,
                previous, target.getFines(), actorUserId);
        return new FineUpdateResponse(action, normalized, previous, UserResponse.from(target));
    }

    public UserResponse toggleStatus(@NonNull Long targetUserId, @NonNull Long actorUserId) {
        LibraryUser target = findUser(targetUserId);
        if (target.getId().equals(actorUserId) && target.isActive()) {
            throw new ProblemException(HttpStatus.CONFLICT, "admin.self_deactivation", "No puede desactivar su propia cuenta");
        }
        target.setActive(!target.isActive());
        log.info("User id={} {} by admin={}", target.getId(), target.isActive() ? "activated" : "deactivated", actorUserId);
        return UserResponse.from(target);
    }

    private LibraryUser findUser(@NonNull Long userId) {
        return libraryUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "admin.user_not_found", "Usuario no encontrado"));
    }

    private UserRole parseRole(String roleCode) {
        try {
            return UserRole.fromCode(roleCode);
        } catch (IllegalArgumentException ex) {
            throw FieldValidationException.of("rol", "Rol inválido. Valores permitidos: usuario, bibliotecario, admin");
        }
    }

    private FineAction parseAction(String actionCode) {
        try {
            return FineAction.fromCode(actionCode);
        } catch (IllegalArgumentException ex) {
            throw FieldValidationException.of("accion", "Acción inválida. Valores permitidos: pagar, agregar, establecer");
        }
    }
}
