package com.carelink.backend.modules.admin.application;

import java.util.List;
import java.util.Locale;

import com.carelink.backend.global.error.ProblemException;
import com.carelink.backend.modules.admin.presentation.dto.AdminUsersResponse;
import com.carelink.backend.modules.user.domain.AccountStatus;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.domain.UserRole;
import com.carelink.backend.modules.user.infrastructure.persistence.UserRepository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class AdminReadService {

    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final int MAX_PAGE_SIZE = 100;

    private final UserRepository userRepository;

    public AdminReadService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public AdminUsersResponse listUsers(String role, String status, String search, int page, int size) {
        UserRole roleFilter = parseEnum(UserRole.class, role, "INVALID_ROLE");
        AccountStatus statusFilter = parseEnum(AccountStatus.class, status, "INVALID_STATUS");
        String searchPattern = (search == null || search.isBlank())
                ? null
                : "%" + search.trim().toLowerCase(Locale.ROOT) + "%";

        int normalizedPage = Math.max(page, 0);
        int normalizedSize = size <= 0 ? DEFAULT_PAGE_SIZE : Math.min(size, MAX_PAGE_SIZE);
        PageRequest pageable = PageRequest.of(normalizedPage, normalizedSize, Sort.by(Sort.Direction.DESC, "createdAt"));

        Page<User> result = userRepository.search(roleFilter, statusFilter, searchPattern, pageable);
        List<AdminUsersResponse.User> items = result.getContent().stream()
                .map(user -> new AdminUsersResponse.User(
                        user.getId(),
                        user.getEmail(),
                        user.getRole().name(),
                        user.getStatus().name(),
                        user.isEmailVerified(),
                        user.getFailedLoginAttempts(),
                        user.getAccountLockedUntil(),
                        user.getLastLoginAt(),
                        user.getCreatedAt()
                ))
                .toList();

        return new AdminUsersResponse(items, result.getNumber(), result.getSize(), result.getTotalElements(), result.getTotalPages());
    }

    static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, String errorCode) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, errorCode, "Unknown value: " + raw);
        }
    }
}
