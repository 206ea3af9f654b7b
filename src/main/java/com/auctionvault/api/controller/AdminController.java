package com.auctionvault.api.controller;

import com.auctionvault.api.dto.request.BlacklistRequest;
import com.auctionvault.api.dto.request.FeeUpdateRequest;
import com.auctionvault.api.dto.request.RecoverTokenRequest;
import com.auctionvault.api.dto.request.ToggleRequest;
import com.auctionvault.api.dto.response.SystemStateResponse;
import com.auctionvault.auth.JwtAuthFilter;
import com.auctionvault.core.engine.AuctionEngine;
import com.auctionvault.domain.enums.Role;
import com.auctionvault.domain.model.SystemStatus;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Role-gated administration. Every endpoint checks the caller's role in the engine,
 * so a token alone grants nothing here.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/admin/emergency -- emergency stop on/off (ADMIN)</li>
 *   <li>POST /api/admin/maintenance -- maintenance mode on/off (MAINTAINER)</li>
 *   <li>POST /api/admin/recover -- recover free treasury balance (RECOVERY)</li>
 *   <li>POST/DELETE /api/admin/blacklist/{bidder} -- blacklist management (OPERATOR)</li>
 *   <li>PUT /api/admin/fee -- platform fee (ADMIN)</li>
 *   <li>POST/DELETE /api/admin/roles/{actor}/{role} -- role management (ADMIN)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final AuctionEngine auctionEngine;
    private final Clock clock;

    public AdminController(AuctionEngine auctionEngine, Clock clock) {
        this.auctionEngine = auctionEngine;
        this.clock = clock;
    }

    @PostMapping("/emergency")
    public ResponseEntity<SystemStateResponse> setEmergencyState(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor, @Valid @RequestBody ToggleRequest request) {
        log.info("Emergency state change requested by '{}': enabled={}", actor, request.getEnabled());
        auctionEngine.setEmergencyState(actor, request.getEnabled(), clock.instant());
        return ResponseEntity.ok(currentState());
    }

    @PostMapping("/maintenance")
    public ResponseEntity<SystemStateResponse> setMaintenanceMode(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor, @Valid @RequestBody ToggleRequest request) {
        auctionEngine.setMaintenanceMode(actor, request.getEnabled(), clock.instant());
        return ResponseEntity.ok(currentState());
    }

    @PostMapping("/recover")
    public ResponseEntity<Map<String, Object>> recoverToken(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor,
            @Valid @RequestBody RecoverTokenRequest request) {
        auctionEngine.recoverToken(actor, request.getAsset(), request.getAmount(), clock.instant());
        return ResponseEntity.ok(Map.of("asset", request.getAsset(), "amount", request.getAmount(), "to", actor));
    }

    @PostMapping("/blacklist/{bidder}")
    public ResponseEntity<SystemStateResponse> blacklistBidder(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor,
            @PathVariable String bidder,
            @Valid @RequestBody(required = false) BlacklistRequest request) {
        String reason = request != null ? request.getReason() : null;
        auctionEngine.blacklistBidder(actor, bidder, reason, clock.instant());
        return ResponseEntity.ok(currentState());
    }

    @DeleteMapping("/blacklist/{bidder}")
    public ResponseEntity<SystemStateResponse> removeFromBlacklist(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor, @PathVariable String bidder) {
        auctionEngine.removeFromBlacklist(actor, bidder, clock.instant());
        return ResponseEntity.ok(currentState());
    }

    @PutMapping("/fee")
    public ResponseEntity<SystemStateResponse> setPlatformFee(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor,
            @Valid @RequestBody FeeUpdateRequest request) {
        auctionEngine.setPlatformFee(actor, request.getPercentage(), clock.instant());
        return ResponseEntity.ok(currentState());
    }

    @PostMapping("/roles/{target}/{role}")
    public ResponseEntity<Map<String, Object>> grantRole(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor,
            @PathVariable String target,
            @PathVariable Role role) {
        auctionEngine.grantRole(actor, target, role, clock.instant());
        return ResponseEntity.ok(Map.of("actor", target, "role", role, "granted", true, "roles", auctionEngine.getRoles(target)));
    }

    @DeleteMapping("/roles/{target}/{role}")
    public ResponseEntity<Map<String, Object>> revokeRole(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor,
            @PathVariable String target,
            @PathVariable Role role) {
        auctionEngine.revokeRole(actor, target, role, clock.instant());
        return ResponseEntity.ok(Map.of("actor", target, "role", role, "granted", false, "roles", auctionEngine.getRoles(target)));
    }

    private SystemStateResponse currentState() {
        SystemStatus status = auctionEngine.getSystemStatus();
        return SystemStateResponse.builder()
                .state(status.getState().name())
                .paused(status.isPaused())
                .platformFeePercentage(auctionEngine.getPlatformFeePercentage())
                .blacklistedBidders(auctionEngine.getBlacklistedBidders())
                .build();
    }
}
