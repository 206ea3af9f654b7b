package com.auctionvault.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.auctionvault.api.controller.SystemController;
import com.auctionvault.core.engine.AuctionEngine;
import com.auctionvault.domain.enums.SystemState;
import com.auctionvault.domain.model.RateLimitStatus;
import com.auctionvault.domain.model.SystemMetrics;
import com.auctionvault.domain.model.SystemStatus;
import com.auctionvault.domain.model.TreasuryPosition;
import com.auctionvault.event.AuctionEvent;
import com.auctionvault.event.AuctionEventLog;
import com.auctionvault.event.AuctionEventType;
import com.auctionvault.exception.GlobalExceptionHandler;
import com.auctionvault.mapper.AuctionMapper;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class SystemControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private MockMvc mockMvc;
    private AuctionEventLog auctionEventLog;

    @Mock
    private AuctionEngine auctionEngine;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        auctionEventLog = new AuctionEventLog(10_000);
        SystemController controller = new SystemController(
                auctionEngine, auctionEventLog, Mappers.getMapper(AuctionMapper.class), Clock.fixed(NOW, ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void metrics_returnsRollups() throws Exception {
        when(auctionEngine.getSystemMetrics()).thenReturn(SystemMetrics.builder()
                .totalAuctions(3)
                .activeAuctions(2)
                .totalVolume(new BigDecimal("115"))
                .lastUpdateTimestamp(NOW)
                .build());

        mockMvc.perform(get("/api/system/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAuctions").value(3))
                .andExpect(jsonPath("$.activeAuctions").value(2))
                .andExpect(jsonPath("$.totalVolume").value(115));
    }

    @Test
    void rateLimit_usesServerClock() throws Exception {
        when(auctionEngine.checkRateLimit("alice", NOW)).thenReturn(new RateLimitStatus(97, null));

        mockMvc.perform(get("/api/system/rate-limit/alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.actor").value("alice"))
                .andExpect(jsonPath("$.actionsRemaining").value(97));
    }

    @Test
    void state_reportsFeeAndBlacklist() throws Exception {
        when(auctionEngine.getSystemStatus()).thenReturn(new SystemStatus(SystemState.MAINTENANCE, false));
        when(auctionEngine.getPlatformFeePercentage()).thenReturn(new BigDecimal("2.5"));
        when(auctionEngine.getBlacklistedBidders()).thenReturn(Set.of("mallory"));

        mockMvc.perform(get("/api/system/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("MAINTENANCE"))
                .andExpect(jsonPath("$.paused").value(false))
                .andExpect(jsonPath("$.platformFeePercentage").value(2.5))
                .andExpect(jsonPath("$.blacklistedBidders[0]").value("mallory"));
    }

    @Test
    void treasury_listsPositionsWithRecoverable() throws Exception {
        when(auctionEngine.getTreasuryPositions()).thenReturn(List.of(
                new TreasuryPosition("USDC", new BigDecimal("41"), new BigDecimal("40"))));

        mockMvc.perform(get("/api/system/treasury"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].asset").value("USDC"))
                .andExpect(jsonPath("$[0].recoverable").value(1));
    }

    @Test
    void events_pagesBySequence() throws Exception {
        auctionEventLog.onAuctionEvent(new AuctionEvent(this, AuctionEventType.CREATED, 1L, "owner", null, NOW));
        auctionEventLog.onAuctionEvent(new AuctionEvent(this, AuctionEventType.BID_PLACED, 1L, "alice", BigDecimal.TEN, NOW));

        mockMvc.perform(get("/api/system/events").param("after", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].sequence").value(2))
                .andExpect(jsonPath("$[0].name").value("BidPlaced"));
    }
}
