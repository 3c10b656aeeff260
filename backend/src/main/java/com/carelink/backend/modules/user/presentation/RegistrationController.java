package com.carelink.backend.modules.user.presentation;

import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.user.application.RegistrationService;
import com.carelink.backend.modules.user.presentation.dto.RegisterClientRequest;
import com.carelink.backend.modules.user.presentation.dto.RegisterCoordinatorRequest;
import com.carelink.backend.modules.user.presentation.dto.RegisterWorkerRequest;
import com.carelink.backend.modules.user.presentation.dto.RegistrationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth/register")
public class RegistrationController {

    private final RegistrationService registrationService;

    public RegistrationController(RegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    @Operation(summary = "Register a support worker")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account and worker profile created"),
            @ApiResponse(responseCode = "400", description = "WEAK_PASSWORD or INVALID_MOBILE"),
            @ApiResponse(responseCode = "409", description = "EMAIL_ALREADY_REGISTERED")
    })
    @PostMapping("/worker")
    public ResponseEntity<RegistrationResponse> registerWorker(
            @Valid @RequestBody RegisterWorkerRequest request,
            HttpServletRequest httpRequest
    ) {
        RegistrationResponse response = registrationService.registerWorker(request, ClientRequestInfo.from(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Register a client")
    @PostMapping("/client")
    public ResponseEntity<RegistrationResponse> registerClient(
            @Valid @RequestBody RegisterClientRequest request,
            HttpServletRequest httpRequest
    ) {
        RegistrationResponse response = registrationService.registerClient(request, ClientRequestInfo.from(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Register a support coordinator")
    @PostMapping("/coordinator")
    public ResponseEntity<RegistrationResponse> registerCoordinator(
            @Valid @RequestBody RegisterCoordinatorRequest request,
            HttpServletRequest httpRequest
    ) {
        RegistrationResponse response = registrationService.registerCoordinator(request, ClientRequestInfo.from(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
