package com.biblioteca.backend.modules.admin.application;

import com.biblioteca.backend.global.error.ProblemException;
import com.biblioteca.backend.global.jpa.LikePatterns;
import com.biblioteca.backend.modules.admin.presentation.dto.AdminUsersResponse;
import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.domain.UserRole;
import com.biblioteca.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.biblioteca.backend.modules.auth.presentation.dto.UserResponse;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional(readOnly = true)
public class AdminReadService {

    private final LibraryUserRepository libraryUserRepository;

    public AdminReadService(LibraryUserRepository libraryUserRepository) {
        this.libraryUserRepository = libraryUserRepository;
    }

    public AdminUsersResponse getUsers(UserRole role, Boolean active, String search, Pageable pageable) {
        String pattern = StringUtils.hasText(search)
                ? LikePatterns.containing(search)
                : null;
        Page<LibraryUser> page = libraryUserRepository.search(role, active, pattern, pageable);
        return new AdminUsersResponse(
                page.getContent().stream().map(UserResponse::from).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages()
        );
    }

    public UserResponse getUser(Long userId) {
        return libraryUserRepository.findById(userId)
                .map(UserResponse::from)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "admin.user_not_found", "Usuario no encontrado"));
    }
}
