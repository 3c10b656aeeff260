package com.carelink.backend.modules.admin.presentation;

import java.util.UUID;

import com.carelink.backend.global.security.SecurityUtils;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.admin.application.AdminMutationService;
import com.carelink.backend.modules.admin.application.AdminReadService;
import com.carelink.backend.modules.admin.presentation.dto.AdminUserResponse;
import com.carelink.backend.modules.admin.presentation.dto.AdminUsersResponse;
import com.carelink.backend.modules.admin.presentation.dto.RoleChangeRequest;
import com.carelink.backend.modules.admin.presentation.dto.UpdateUserStatusRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users")
public class AdminUserController {

    private final AdminReadService adminReadService;
    private final AdminMutationService adminMutationService;

    public AdminUserController(AdminReadService adminReadService, AdminMutationService adminMutationService) {
        this.adminReadService = adminReadService;
        this.adminMutationService = adminMutationService;
    }

    @GetMapping
    public ResponseEntity<AdminUsersResponse> listUsers(
            @RequestParam(name = "role", required = false) String role,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(adminReadService.listUsers(role, status, search, page, size));
    }

    @Operation(summary = "Change a user's role")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Role updated"),
            @ApiResponse(responseCode = "409", description = "CANNOT_CHANGE_OWN_ROLE")
    })
    @PatchMapping("/{userId}/role")
    public ResponseEntity<AdminUserResponse> changeRole(
            @PathVariable UUID userId,
            @Valid @RequestBody RoleChangeRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(adminMutationService.changeRole(
                userId, SecurityUtils.getCurrentUserId(), request.role(), ClientRequestInfo.from(httpRequest)));
    }

    @Operation(summary = "Activate or suspend a user", description = "Suspension signs the user out everywhere.")
    @PatchMapping("/{userId}/status")
    public ResponseEntity<AdminUserResponse> updateStatus(
            @PathVariable UUID userId,
            @Valid @RequestBody UpdateUserStatusRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(adminMutationService.updateStatus(
                userId, SecurityUtils.getCurrentUserId(), request.status(), request.reason(), ClientRequestInfo.from(httpRequest)));
    }

    @PostMapping("/{userId}/unlock")
    public ResponseEntity<AdminUserResponse> unlock(@PathVariable UUID userId, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(adminMutationService.unlock(userId, SecurityUtils.getCurrentUserId(), ClientRequestInfo.from(httpRequest)));
    }
}
