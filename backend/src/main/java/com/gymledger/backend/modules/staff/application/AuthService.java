package com.gymledger.backend.modules.staff.application;

import com.gymledger.backend.global.error.ProblemException;
import com.gymledger.backend.modules.staff.application.JwtTokenService.IssuedToken;
import com.gymledger.backend.modules.staff.domain.StaffUser;
import com.gymledger.backend.modules.staff.infrastructure.StaffUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final StaffUserRepository staffUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            StaffUserRepository staffUserRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.staffUserRepository = staffUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public LoginResult login(String email, String password) {
        StaffUser staff = staffUserRepository.findByEmailIgnoreCase(email)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));

        // tombstoned accounts look exactly like unknown ones
        if (staff.isDeleted() || !passwordEncoder.matches(password, staff.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }

        if (!staff.canAct()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "STAFF_INACTIVE", "Staff account is inactive");
        }

        IssuedToken token = jwtTokenService.issueAccessToken(staff);
        log.info("Staff {} signed in to gym {}", staff.getId(), staff.getGym().getId());
        return new LoginResult(staff, token);
    }

    public record LoginResult(StaffUser staff, IssuedToken token) {
    }
}
