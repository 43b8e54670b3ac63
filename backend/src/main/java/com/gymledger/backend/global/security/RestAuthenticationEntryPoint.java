package com.gymledger.backend.global.security;

import java.io.IOException;

import com.gymledger.backend.global.error.ProblemResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Requests without a usable staff token. Missing, expired and tampered tokens
 * all end here because the JWT filter leaves them unauthenticated.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private static final String DETAIL = "A valid staff access token is required";

    private final ProblemResponseWriter problemResponseWriter;

    public RestAuthenticationEntryPoint(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer realm=\"gymledger\"");
        problemResponseWriter.write(response,
                ProblemResponse.of(HttpStatus.UNAUTHORIZED, "unauthorized", DETAIL, request.getRequestURI()));
    }
}
