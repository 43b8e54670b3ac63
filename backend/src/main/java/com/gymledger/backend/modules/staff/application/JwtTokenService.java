package com.gymledger.backend.modules.staff.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.gymledger.backend.modules.staff.domain.StaffUser;
import com.gymledger.backend.modules.staff.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    static final String CLAIM_GYM_ID = "gymId";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:3600000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public IssuedToken issueAccessToken(StaffUser staff) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(accessTokenTtlMillis);

        String token = Jwts.builder()
                .subject(staff.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_GYM_ID, staff.getGym().getId().toString())
                .claim(CLAIM_EMAIL, staff.getEmail())
                .claim(CLAIM_ROLE, staff.getRole().name())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(token, accessTokenTtlMillis / 1000L, OffsetDateTime.ofInstant(expiry, clock.getZone()));
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID staffId = UUID.fromString(claims.getSubject());
            String gymClaim = claims.get(CLAIM_GYM_ID, String.class);
            if (gymClaim == null) {
                throw new InvalidTokenException("Access token carries no gym", null);
            }
            return new ParsedToken(
                    staffId,
                    UUID.fromString(gymClaim),
                    claims.get(CLAIM_EMAIL, String.class),
                    claims.get(CLAIM_ROLE, String.class)
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record IssuedToken(String accessToken, long expiresInSeconds, OffsetDateTime expiresAt) {
    }

    public record ParsedToken(UUID staffId, UUID gymId, String email, String role) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
