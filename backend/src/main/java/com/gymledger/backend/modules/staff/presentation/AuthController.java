package com.gymledger.backend.modules.staff.presentation;

import com.gymledger.backend.modules.staff.application.AuthService;
import com.gymledger.backend.modules.staff.application.AuthService.LoginResult;
import com.gymledger.backend.modules.staff.presentation.dto.LoginRequest;
import com.gymledger.backend.modules.staff.presentation.dto.LoginResponse;
import com.gymledger.backend.modules.staff.presentation.dto.StaffResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/login")
    @Operation(summary = "Exchange staff credentials for an access token")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        LoginResult result = authService.login(request.email(), request.password());
        return ResponseEntity.ok(new LoginResponse(
                result.token().accessToken(),
                LoginResponse.DEFAULT_TOKEN_TYPE,
                result.token().expiresInSeconds(),
                result.token().expiresAt(),
                StaffResponse.from(result.staff())
        ));
    }
}
