package com.auctionvault.api.controller;

import com.auctionvault.api.dto.request.TokenRequest;
import com.auctionvault.api.dto.response.TokenResponse;
import com.auctionvault.auth.AppAuthService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Issues bearer tokens. The token's subject is the actor id every other endpoint acts as.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/auth/token - exchange an actor's own API key for a token bound to that actor</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final AppAuthService appAuthService;

    public AuthController(AppAuthService appAuthService) {
        this.appAuthService = appAuthService;
    }

    @PostMapping("/token")
    public ResponseEntity<TokenResponse> issueToken(@Valid @RequestBody TokenRequest request) {
        String token = appAuthService.issueToken(request.getActorId(), request.getApiKey());
        log.info("Token issued for actor '{}'", request.getActorId());
        return ResponseEntity.ok(TokenResponse.builder()
                .token(token)
                .actorId(request.getActorId())
                .expiresAt(appAuthService.getTokenExpiry(token))
                .build());
    }
}
