package com.auctionvault.api.controller;

import com.auctionvault.api.dto.response.RateLimitStatusResponse;
import com.auctionvault.api.dto.response.SystemMetricsResponse;
import com.auctionvault.api.dto.response.SystemStateResponse;
import com.auctionvault.core.engine.AuctionEngine;
import com.auctionvault.domain.model.RateLimitStatus;
import com.auctionvault.domain.model.SystemStatus;
import com.auctionvault.domain.model.TreasuryPosition;
import com.auctionvault.event.AuctionEventLog;
import com.auctionvault.event.EventLogEntry;
import com.auctionvault.mapper.AuctionMapper;
import java.time.Clock;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only system views: rollups, throttle status, circuit breaker, treasury and the
 * event log.
 */
@RestController
@RequestMapping("/api/system")
public class SystemController {

    private final AuctionEngine auctionEngine;
    private final AuctionEventLog auctionEventLog;
    private final AuctionMapper auctionMapper;
    private final Clock clock;

    public SystemController(
            AuctionEngine auctionEngine, AuctionEventLog auctionEventLog, AuctionMapper auctionMapper, Clock clock) {
        this.auctionEngine = auctionEngine;
        this.auctionEventLog = auctionEventLog;
        this.auctionMapper = auctionMapper;
        this.clock = clock;
    }

    @GetMapping("/metrics")
    public ResponseEntity<SystemMetricsResponse> getSystemMetrics() {
        return ResponseEntity.ok(auctionMapper.toResponse(auctionEngine.getSystemMetrics()));
    }

    @GetMapping("/rate-limit/{actor}")
    public ResponseEntity<RateLimitStatusResponse> checkRateLimit(@PathVariable String actor) {
        RateLimitStatus status = auctionEngine.checkRateLimit(actor, clock.instant());
        return ResponseEntity.ok(RateLimitStatusResponse.builder()
                .actor(actor)
                .actionsRemaining(status.getActionsRemaining())
                .cooldownEnds(status.getCooldownEnds())
                .build());
    }

    @GetMapping("/state")
    public ResponseEntity<SystemStateResponse> getState() {
        SystemStatus status = auctionEngine.getSystemStatus();
        return ResponseEntity.ok(SystemStateResponse.builder()
                .state(status.getState().name())
                .paused(status.isPaused())
                .platformFeePercentage(auctionEngine.getPlatformFeePercentage())
                .blacklistedBidders(auctionEngine.getBlacklistedBidders())
                .build());
    }

    @GetMapping("/treasury")
    public ResponseEntity<List<TreasuryPosition>> getTreasury() {
        return ResponseEntity.ok(auctionEngine.getTreasuryPositions());
    }

    /**
     * Events with a sequence number greater than {@code after}, oldest first.
     */
    @GetMapping("/events")
    public ResponseEntity<List<EventLogEntry>> getEvents(@RequestParam(defaultValue = "0") long after) {
        return ResponseEntity.ok(auctionEventLog.after(after));
    }
}
