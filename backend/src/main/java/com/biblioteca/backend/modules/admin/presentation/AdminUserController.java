package com.biblioteca.backend.modules.admin.presentation;

import com.biblioteca.backend.global.error.ProblemException;
import com.biblioteca.backend.global.security.JwtAuthenticationPrincipal;
import com.biblioteca.backend.modules.admin.application.AdminMutationService;
import com.biblioteca.backend.modules.admin.application.AdminReadService;
import com.biblioteca.backend.modules.admin.presentation.dto.AdminUsersResponse;
import com.biblioteca.backend.modules.admin.presentation.dto.ChangeRoleRequest;
import com.biblioteca.backend.modules.admin.presentation.dto.FineUpdateResponse;
import com.biblioteca.backend.modules.admin.presentation.dto.ManageFineRequest;
import com.biblioteca.backend.modules.auth.domain.UserRole;
import com.biblioteca.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/usuarios")
@Tag(name = "Administración de usuarios")
@SecurityRequirement(name = "bearerAuth")
public class AdminUserController {

    private static final int MAX_PAGE_SIZE = 100;
    private static final int MAX_PAGE = Integer.MAX_VALUE / MAX_PAGE_SIZE;

    private final AdminReadService adminReadService;
    private final AdminMutationService adminMutationService;

    public AdminUserController(AdminReadService adminReadService, AdminMutationService adminMutationService) {
        this.adminReadService = adminReadService;
        this.adminMutationService = adminMutationService;
    }

    @Operation(summary = "Listar usuarios", description = "Filtra por rol, estado y texto libre (nombre, apellido, correo o identidad).")
    @GetMapping
    public ResponseEntity<AdminUsersResponse> getUsers(
            @RequestParam(name = "rol", required = false) String role,
            @RequestParam(name = "activo", required = false) Boolean active,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        int safePage = Math.min(Math.max(page, 0), MAX_PAGE);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        return ResponseEntity.ok(adminReadService.getUsers(parseRole(role), active, search, PageRequest.of(safePage, safeSize)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<UserResponse> getUser(@PathVariable("id") Long userId) {
        return ResponseEntity.ok(adminReadService.getUser(userId));
    }

    @Operation(summary = "Cambiar rol", description = "Solo administradores. Un administrador no puede cambiar su propio rol.")
    @PutMapping("/{id}/cambiar-rol")
    public ResponseEntity<UserResponse> changeRole(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("id") Long userId,
            @Valid @RequestBody ChangeRoleRequest request
    ) {
        return ResponseEntity.ok(adminMutationService.changeRole(userId, principal.userId(), request.rol()));
    }

    @Operation(summary = "Gestionar multa", description = "`accion`: pagar, agregar o establecer.")
    @PutMapping("/{id}/gestionar-multa")
    public ResponseEntity<FineUpdateResponse> manageFine(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("id") Long userId,
            @Valid @RequestBody ManageFineRequest request
    ) {
        return ResponseEntity.ok(adminMutationService.manageFine(userId, principal.userId(), request.accion(), request.monto()));
    }

    @Operation(summary = "Activar / desactivar usuario", description = "Solo administradores.")
    @PutMapping("/{id}/toggle-estado")
    public ResponseEntity<UserResponse> toggleStatus(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("id") Long userId
    ) {
        return ResponseEntity.ok(adminMutationService.toggleStatus(userId, principal.userId()));
    }

    private UserRole parseRole(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UserRole.fromCode(value);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "invalid_parameter", "Rol inválido: " + value);
        }
    }
}
