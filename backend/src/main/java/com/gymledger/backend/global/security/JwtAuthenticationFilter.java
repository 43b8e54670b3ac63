package com.gymledger.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.gymledger.backend.global.error.ProblemException;
import com.gymledger.backend.global.error.ProblemResponse;
import com.gymledger.backend.global.web.RequestIdFilter;
import com.gymledger.backend.modules.staff.application.JwtTokenService;
import com.gymledger.backend.modules.staff.application.JwtTokenService.InvalidTokenException;
import com.gymledger.backend.modules.staff.application.JwtTokenService.ParsedToken;
import com.gymledger.backend.modules.staff.application.StaffService;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";
    private final JwtTokenService jwtTokenService;
    private final StaffService staffService;
    private final ProblemResponseWriter problemResponseWriter;

    public JwtAuthenticationFilter(
            JwtTokenService jwtTokenService,
            StaffService staffService,
            ProblemResponseWriter problemResponseWriter
    ) {
        this.jwtTokenService = jwtTokenService;
        this.staffService = staffService;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length());
            ParsedToken parsed;
            try {
                parsed = jwtTokenService.parseAccessToken(token);
            } catch (InvalidTokenException ex) {
                // falls through unauthenticated; the entry point answers 401
                log.debug("Rejected access token: {}", ex.getMessage());
                SecurityContextHolder.clearContext();
                filterChain.doFilter(request, response);
                return;
            }

            // tokens outlive status changes, so the account is re-read on every request
            try {
                staffService.requireSignedInStaff(parsed.gymId(), parsed.staffId());
            } catch (ProblemException ex) {
                log.info("Refused token of staff {}: {}", parsed.staffId(), ex.getCode());
                SecurityContextHolder.clearContext();
                HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
                problemResponseWriter.write(response, ProblemResponse.of(status, ex.getCode(),
                        ex.getDetailMessage(), request.getRequestURI(), ex.getContext()));
                return;
            }

            StaffPrincipal principal = new StaffPrincipal(
                    parsed.staffId(),
                    parsed.gymId(),
                    parsed.email(),
                    parsed.role()
            );

            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(principal, token, authoritiesFor(parsed.role()));
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
            MDC.put(RequestIdFilter.GYM_ID_MDC_KEY, parsed.gymId().toString());
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.startsWith("/auth/") || path.startsWith("/actuator");
    }

    private List<SimpleGrantedAuthority> authoritiesFor(String role) {
        List<SimpleGrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_STAFF"));
        if ("OWNER".equals(role)) {
            authorities.add(new SimpleGrantedAuthority("ROLE_OWNER"));
        }
        return authorities;
    }
}
