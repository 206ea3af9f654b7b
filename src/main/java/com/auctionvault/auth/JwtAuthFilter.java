package com.auctionvault.auth;

import com.auctionvault.api.dto.response.ApiErrorResponse;
import com.auctionvault.exception.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates every /api/** request from its bearer token and exposes the caller's
 * actor id as the request attribute {@value #ACTOR_ATTRIBUTE}.
 *
 * <p>Skips the token endpoint and actuator. Registered via
 * {@link com.auctionvault.config.WebConfig}.
 */
@Component
public class JwtAuthFilter extends OncePerRequestFilter {

    public static final String ACTOR_ATTRIBUTE = "actorId";

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final AppAuthService appAuthService;
    private final ObjectMapper objectMapper;

    public JwtAuthFilter(AppAuthService appAuthService, ObjectMapper objectMapper) {
        this.appAuthService = appAuthService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.equals("/api/auth/token") || path.startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authHeader = request.getHeader("Authorization");

        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            writeUnauthenticated(response, request.getRequestURI(), "Missing or invalid Authorization header");
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length());

        try {
            String actorId = appAuthService.validateToken(token);
            request.setAttribute(ACTOR_ATTRIBUTE, actorId);
            filterChain.doFilter(request, response);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("JWT validation failed: {}", e.getMessage());
            writeUnauthenticated(response, request.getRequestURI(), "Invalid or expired token");
        }
    }

    private void writeUnauthenticated(HttpServletResponse response, String path, String message) throws IOException {
        ApiErrorResponse errorResponse = ApiErrorResponse.of(ErrorCode.UNAUTHENTICATED, message, Map.of(), path);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        objectMapper.writeValue(response.getOutputStream(), errorResponse);
    }
}
