package com.auctionvault.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.auctionvault.api.controller.AuctionController;
import com.auctionvault.auth.JwtAuthFilter;
import com.auctionvault.config.ApiResponseAdvice;
import com.auctionvault.core.engine.AuctionEngine;
import com.auctionvault.domain.model.Bid;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import com.auctionvault.exception.GlobalExceptionHandler;
import com.auctionvault.mapper.AuctionMapper;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Envelope behaviour on engine routes: the acting identity is stamped on success
 * bodies and the response header, error bodies pass through untouched.
 */
class ApiResponseAdviceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private MockMvc mockMvc;

    @Mock
    private AuctionEngine auctionEngine;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        AuctionController controller = new AuctionController(
                auctionEngine, Mappers.getMapper(AuctionMapper.class), Clock.fixed(NOW, ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    void authenticatedRoute_stampsActorOnEnvelopeAndHeader() throws Exception {
        when(auctionEngine.getEscrowBalance(1L, "alice")).thenReturn(new BigDecimal("45"));

        mockMvc.perform(get("/api/auctions/1/escrow").requestAttr(JwtAuthFilter.ACTOR_ATTRIBUTE, "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.actorId").value("alice"))
                .andExpect(jsonPath("$.data.balance").value(45))
                .andExpect(header().string(ApiResponseAdvice.ACTOR_HEADER, "alice"));
    }

    @Test
    void anonymousRead_omitsActor() throws Exception {
        when(auctionEngine.getBids(1L)).thenReturn(List.of(
                Bid.builder().auctionId(1L).index(0).bidder("alice").amount(new BigDecimal("15")).timestamp(NOW).build()));

        mockMvc.perform(get("/api/auctions/1/bids"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].bidder").value("alice"))
                .andExpect(jsonPath("$.actorId").doesNotExist())
                .andExpect(header().doesNotExist(ApiResponseAdvice.ACTOR_HEADER));
    }

    @Test
    void engineError_isNotWrapped() throws Exception {
        when(auctionEngine.getAuction(9L))
                .thenThrow(new AuctionException(ErrorCode.INVALID_AUCTION, "Auction #9 does not exist"));

        mockMvc.perform(get("/api/auctions/9"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data").doesNotExist())
                .andExpect(jsonPath("$.error.code").value("INVALID_AUCTION"))
                .andExpect(jsonPath("$.error.retryable").value(false));
    }
}
