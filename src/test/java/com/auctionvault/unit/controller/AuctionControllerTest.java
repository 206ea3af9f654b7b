package com.auctionvault.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.auctionvault.api.controller.AuctionController;
import com.auctionvault.auth.JwtAuthFilter;
import com.auctionvault.core.engine.AuctionEngine;
import com.auctionvault.domain.model.AuctionItem;
import com.auctionvault.domain.model.Bid;
import com.auctionvault.domain.model.HighestBid;
import com.auctionvault.domain.model.PaymentProof;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import com.auctionvault.exception.GlobalExceptionHandler;
import com.auctionvault.exception.UnauthorizedException;
import com.auctionvault.mapper.AuctionMapper;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for AuctionController.
 *
 * <p>Verifies: create (201), bid (201) with payment proof, bid history, end, cancel,
 * withdraw, escrow lookup and error mapping.
 */
class AuctionControllerTest {

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
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private AuctionItem auction(long id) {
        return AuctionItem.builder()
                .id(id)
                .assetId("ASSET-" + id)
                .paymentAsset("NATIVE")
                .owner("owner")
                .reservePrice(new BigDecimal("10"))
                .buyNowPrice(new BigDecimal("100"))
                .minimumBidIncrement(BigDecimal.ONE)
                .timeExtension(Duration.ofSeconds(120))
                .extensionWindow(Duration.ofSeconds(300))
                .feePercentage(BigDecimal.ZERO)
                .createdAt(NOW)
                .endTime(NOW.plusSeconds(3600))
                .build();
    }

    @Test
    void createAuction_returns201() throws Exception {
        when(auctionEngine.createAuction(eq("owner"), any(), eq(NOW))).thenReturn(1L);
        when(auctionEngine.getAuction(1L)).thenReturn(auction(1L));
        when(auctionEngine.getHighestBid(1L)).thenReturn(HighestBid.none());

        mockMvc.perform(post("/api/auctions")
                        .requestAttr(JwtAuthFilter.ACTOR_ATTRIBUTE, "owner")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"assetId":"ASSET-1","paymentAsset":"NATIVE","reservePrice":10,"buyNowPrice":100,
                         "minimumBidIncrement":1,"durationSeconds":3600,"timeExtensionSeconds":120,"extensionWindowSeconds":300}
                        """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.owner").value("owner"))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.extensionWindowSeconds").value(300));

        verify(auctionEngine).createAuction(
                eq("owner"),
                argThat(terms -> terms.getDuration().equals(Duration.ofHours(1))
                        && terms.getTimeExtension().equals(Duration.ofMinutes(2))),
                eq(NOW));
    }

    @Test
    void createAuction_missingDuration_returns400() throws Exception {
        mockMvc.perform(post("/api/auctions")
                        .requestAttr(JwtAuthFilter.ACTOR_ATTRIBUTE, "owner")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"assetId":"ASSET-1","paymentAsset":"NATIVE","reservePrice":10,"buyNowPrice":100,"minimumBidIncrement":1}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void placeBid_returns201() throws Exception {
        Bid bid = Bid.builder().auctionId(1L).index(0).bidder("alice").amount(new BigDecimal("15")).timestamp(NOW).build();
        when(auctionEngine.placeBid(eq(1L), eq("alice"), any(), any(), eq(NOW))).thenReturn(bid);

        mockMvc.perform(post("/api/auctions/1/bids")
                        .requestAttr(JwtAuthFilter.ACTOR_ATTRIBUTE, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"amount":15,"attachedValue":15}
                        """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.bidder").value("alice"))
                .andExpect(jsonPath("$.index").value(0));

        verify(auctionEngine).placeBid(
                eq(1L),
                eq("alice"),
                argThat(amount -> amount.compareTo(new BigDecimal("15")) == 0),
                argThat((PaymentProof proof) -> proof.getAttachedValue().compareTo(new BigDecimal("15")) == 0),
                eq(NOW));
    }

    @Test
    void placeBid_tooLow_returns422() throws Exception {
        when(auctionEngine.placeBid(eq(1L), eq("carol"), any(), any(), eq(NOW)))
                .thenThrow(new AuctionException(ErrorCode.BID_TOO_LOW, "Bid 12 must exceed 21"));

        mockMvc.perform(post("/api/auctions/1/bids")
                        .requestAttr(JwtAuthFilter.ACTOR_ATTRIBUTE, "carol")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"amount":12,"attachedValue":12}
                        """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("BID_TOO_LOW"))
                .andExpect(jsonPath("$.error.retryable").value(false))
                .andExpect(jsonPath("$.error.path").value("/api/auctions/1/bids"));
    }

    @Test
    void placeBid_duringCooldown_returns429Retryable() throws Exception {
        when(auctionEngine.placeBid(eq(1L), eq("alice"), any(), any(), eq(NOW)))
                .thenThrow(new AuctionException(ErrorCode.COOLDOWN_PERIOD, "Bidder alice is cooling down"));

        mockMvc.perform(post("/api/auctions/1/bids")
                        .requestAttr(JwtAuthFilter.ACTOR_ATTRIBUTE, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"amount":30,"attachedValue":30}
                        """))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error.code").value("COOLDOWN_PERIOD"))
                .andExpect(jsonPath("$.error.retryable").value(true));
    }

    @Test
    void placeBid_nonPositiveAmount_returns400() throws Exception {
        mockMvc.perform(post("/api/auctions/1/bids")
                        .requestAttr(JwtAuthFilter.ACTOR_ATTRIBUTE, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"amount":0}
                        """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getBids_returnsHistory() throws Exception {
        when(auctionEngine.getBids(1L)).thenReturn(List.of(
                Bid.builder().auctionId(1L).index(0).bidder("alice").amount(new BigDecimal("15")).timestamp(NOW).build(),
                Bid.builder().auctionId(1L).index(1).bidder("bob").amount(new BigDecimal("20")).timestamp(NOW).build()));
        when(auctionEngine.getBidCount(1L)).thenReturn(2);

        mockMvc.perform(get("/api/auctions/1/bids"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].bidder").value("bob"));

        mockMvc.perform(get("/api/auctions/1/bids/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2));
    }

    @Test
    void getBid_outOfRange_returns404() throws Exception {
        when(auctionEngine.getBid(1L, 5)).thenThrow(new IndexOutOfBoundsException("Bid index 5 out of range"));

        mockMvc.perform(get("/api/auctions/1/bids/5"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void getAuction_unknown_returns422() throws Exception {
        when(auctionEngine.getAuction(9L))
                .thenThrow(new AuctionException(ErrorCode.INVALID_AUCTION, "Auction #9 does not exist"));

        mockMvc.perform(get("/api/auctions/9"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("INVALID_AUCTION"));
    }

    @Test
    void endAuction_returnsSettledAuction() throws Exception {
        AuctionItem ended = auction(1L).toBuilder().active(false).closedAt(NOW).build();
        when(auctionEngine.endAuction(1L, "anyone", NOW)).thenReturn(ended);
        when(auctionEngine.getHighestBid(1L)).thenReturn(HighestBid.of("bob", new BigDecimal("40")));
        when(auctionEngine.getBidCount(1L)).thenReturn(2);

        mockMvc.perform(post("/api/auctions/1/end").requestAttr(JwtAuthFilter.ACTOR_ATTRIBUTE, "anyone"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ENDED"))
                .andExpect(jsonPath("$.highestBidder").value("bob"))
                .andExpect(jsonPath("$.bidCount").value(2));
    }

    @Test
    void cancelAuction_byStranger_returns403() throws Exception {
        when(auctionEngine.cancelAuction(1L, "stranger", NOW))
                .thenThrow(new UnauthorizedException("Only the owner or an auctioneer may cancel"));

        mockMvc.perform(post("/api/auctions/1/cancel").requestAttr(JwtAuthFilter.ACTOR_ATTRIBUTE, "stranger"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));
    }

    @Test
    void withdraw_returnsAmountPaid() throws Exception {
        when(auctionEngine.withdrawFunds(1L, "alice", NOW)).thenReturn(new BigDecimal("15"));

        mockMvc.perform(post("/api/auctions/1/withdraw").requestAttr(JwtAuthFilter.ACTOR_ATTRIBUTE, "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.auctionId").value(1))
                .andExpect(jsonPath("$.bidder").value("alice"))
                .andExpect(jsonPath("$.amountPaid").value(15));
    }

    @Test
    void escrow_returnsCallerBalance() throws Exception {
        when(auctionEngine.getEscrowBalance(1L, "alice")).thenReturn(new BigDecimal("45"));

        mockMvc.perform(get("/api/auctions/1/escrow").requestAttr(JwtAuthFilter.ACTOR_ATTRIBUTE, "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(45));
    }
}
