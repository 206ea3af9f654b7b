package com.auctionvault.auth;

import com.auctionvault.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and validates the bearer tokens that carry caller identity into the engine.
 *
 * <p>A token's subject is the actor id every engine operation receives as its caller.
 * Each actor has its own API key, configured in {@code auctionvault.auth.credentials}
 * as comma-separated {@code actor=key} pairs. A token is only issued for the actor
 * whose key is presented. Tokens are signed with HS256 and expire after
 * {@code auctionvault.auth.token-ttl}.
 *
 * <p>Roles are not encoded in the token: they are looked up in
 * {@link AccessControlService} on every gated call, so a revocation takes effect
 * immediately.
 */
@Service
public class AppAuthService {

    private static final Logger log = LoggerFactory.getLogger(AppAuthService.class);

    private final SecretKey secretKey;
    private final Map<String, byte[]> credentials;
    private final Duration tokenTtl;
    private final Clock clock;

    public AppAuthService(
            @Value("${auctionvault.auth.jwt-secret}") String jwtSecret,
            @Value("${auctionvault.auth.credentials:}") String credentials,
            @Value("${auctionvault.auth.token-ttl:24h}") Duration tokenTtl,
            Clock clock) {
        this.secretKey = new SecretKeySpec(jwtSecret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.credentials = parseCredentials(credentials);
        this.tokenTtl = tokenTtl;
        this.clock = clock;
        log.info("Loaded API keys for {} actor(s)", this.credentials.size());
    }

    /**
     * Issues a token for {@code actorId} if {@code presentedKey} is that actor's API key.
     *
     * @throws UnauthorizedException if the actor is unknown, the key is wrong or the actor id is blank
     */
    public String issueToken(String actorId, String presentedKey) {
        if (actorId == null || actorId.isBlank()) {
            throw new UnauthorizedException("Actor id is required");
        }
        byte[] expected = credentials.get(actorId);
        byte[] presented = presentedKey != null ? presentedKey.getBytes(StandardCharsets.UTF_8) : new byte[0];
        if (expected == null || !MessageDigest.isEqual(expected, presented)) {
            log.warn("Token request for actor '{}' rejected: bad credentials", actorId);
            throw new UnauthorizedException("Invalid actor id or API key");
        }
        log.info("Issued token for actor '{}'", actorId);
        return generateToken(actorId);
    }

    /**
     * Validates the given token and returns the actor id (subject).
     *
     * @throws JwtException if the token is invalid, expired, or tampered
     */
    public String validateToken(String token) {
        return parseClaims(token).getSubject();
    }

    /**
     * Returns the expiration instant carried by a valid token.
     */
    public Instant getTokenExpiry(String token) {
        return parseClaims(token).getExpiration().toInstant();
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    private String generateToken(String actorId) {
        Instant now = clock.instant();
        Instant expiry = now.plus(tokenTtl);

        return Jwts.builder()
                .subject(actorId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .signWith(secretKey)
                .compact();
    }

    private static Map<String, byte[]> parseCredentials(String csv) {
        Map<String, byte[]> parsed = new LinkedHashMap<>();
        for (String pair : csv.split(",")) {
            String trimmed = pair.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int separator = trimmed.indexOf('=');
            if (separator <= 0 || separator == trimmed.length() - 1) {
                throw new IllegalArgumentException("Credential entries must be actor=key, got: '" + trimmed + "'");
            }
            parsed.put(
                    trimmed.substring(0, separator).trim(),
                    trimmed.substring(separator + 1).trim().getBytes(StandardCharsets.UTF_8));
        }
        return Collections.unmodifiableMap(parsed);
    }
}
