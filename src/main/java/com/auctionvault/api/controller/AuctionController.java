package com.auctionvault.api.controller;

import com.auctionvault.api.dto.request.CreateAuctionRequest;
import com.auctionvault.api.dto.request.PlaceBidRequest;
import com.auctionvault.api.dto.response.AuctionResponse;
import com.auctionvault.api.dto.response.BidResponse;
import com.auctionvault.api.dto.response.EscrowBalanceResponse;
import com.auctionvault.api.dto.response.WithdrawalResponse;
import com.auctionvault.auth.JwtAuthFilter;
import com.auctionvault.core.engine.AuctionEngine;
import com.auctionvault.domain.model.AuctionItem;
import com.auctionvault.domain.model.AuctionTerms;
import com.auctionvault.domain.model.Bid;
import com.auctionvault.domain.model.PaymentProof;
import com.auctionvault.mapper.AuctionMapper;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for auctions, bids and escrow. The caller is the authenticated actor;
 * the time of every operation is the server clock.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/auctions -- create an auction owned by the caller</li>
 *   <li>GET /api/auctions, GET /api/auctions/{id} -- auctions with their current leader</li>
 *   <li>POST /api/auctions/{id}/bids -- bid as the caller</li>
 *   <li>GET /api/auctions/{id}/bids, /bids/count, /bids/{index} -- bid history</li>
 *   <li>POST /api/auctions/{id}/end -- settle an auction past its end time</li>
 *   <li>POST /api/auctions/{id}/cancel -- cancel (owner or AUCTIONEER)</li>
 *   <li>POST /api/auctions/{id}/withdraw -- pay out the caller's escrow</li>
 *   <li>GET /api/auctions/{id}/escrow -- the caller's escrow balance</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/auctions")
public class AuctionController {

    private final AuctionEngine auctionEngine;
    private final AuctionMapper auctionMapper;
    private final Clock clock;

    public AuctionController(AuctionEngine auctionEngine, AuctionMapper auctionMapper, Clock clock) {
        this.auctionEngine = auctionEngine;
        this.auctionMapper = auctionMapper;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<AuctionResponse> createAuction(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor,
            @Valid @RequestBody CreateAuctionRequest request) {
        AuctionTerms terms = AuctionTerms.builder()
                .assetId(request.getAssetId())
                .paymentAsset(request.getPaymentAsset())
                .reservePrice(request.getReservePrice())
                .buyNowPrice(request.getBuyNowPrice())
                .minimumBidIncrement(request.getMinimumBidIncrement())
                .duration(Duration.ofSeconds(request.getDurationSeconds()))
                .timeExtension(Duration.ofSeconds(request.getTimeExtensionSeconds()))
                .extensionWindow(Duration.ofSeconds(request.getExtensionWindowSeconds()))
                .build();
        long auctionId = auctionEngine.createAuction(actor, terms, clock.instant());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(auctionEngine.getAuction(auctionId)));
    }

    @GetMapping
    public ResponseEntity<List<AuctionResponse>> listAuctions() {
        return ResponseEntity.ok(
                auctionEngine.listAuctions().stream().map(this::toResponse).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<AuctionResponse> getAuction(@PathVariable long id) {
        return ResponseEntity.ok(toResponse(auctionEngine.getAuction(id)));
    }

    @PostMapping("/{id}/bids")
    public ResponseEntity<BidResponse> placeBid(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor,
            @PathVariable long id,
            @Valid @RequestBody PlaceBidRequest request) {
        PaymentProof proof = new PaymentProof(request.getAttachedValue(), request.getPaymentReference());
        Bid bid = auctionEngine.placeBid(id, actor, request.getAmount(), proof, clock.instant());
        return ResponseEntity.status(HttpStatus.CREATED).body(auctionMapper.toResponse(bid));
    }

    @GetMapping("/{id}/bids")
    public ResponseEntity<List<BidResponse>> getBids(@PathVariable long id) {
        return ResponseEntity.ok(auctionMapper.toBidResponses(auctionEngine.getBids(id)));
    }

    @GetMapping("/{id}/bids/count")
    public ResponseEntity<Map<String, Integer>> getBidCount(@PathVariable long id) {
        return ResponseEntity.ok(Map.of("count", auctionEngine.getBidCount(id)));
    }

    @GetMapping("/{id}/bids/{index}")
    public ResponseEntity<BidResponse> getBid(@PathVariable long id, @PathVariable int index) {
        return ResponseEntity.ok(auctionMapper.toResponse(auctionEngine.getBid(id, index)));
    }

    @PostMapping("/{id}/end")
    public ResponseEntity<AuctionResponse> endAuction(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor, @PathVariable long id) {
        return ResponseEntity.ok(toResponse(auctionEngine.endAuction(id, actor, clock.instant())));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<AuctionResponse> cancelAuction(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor, @PathVariable long id) {
        return ResponseEntity.ok(toResponse(auctionEngine.cancelAuction(id, actor, clock.instant())));
    }

    @PostMapping("/{id}/withdraw")
    public ResponseEntity<WithdrawalResponse> withdrawFunds(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor, @PathVariable long id) {
        BigDecimal paid = auctionEngine.withdrawFunds(id, actor, clock.instant());
        return ResponseEntity.ok(WithdrawalResponse.builder()
                .auctionId(id)
                .bidder(actor)
                .amountPaid(paid)
                .build());
    }

    @GetMapping("/{id}/escrow")
    public ResponseEntity<EscrowBalanceResponse> getEscrowBalance(
            @RequestAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE) String actor, @PathVariable long id) {
        return ResponseEntity.ok(EscrowBalanceResponse.builder()
                .auctionId(id)
                .bidder(actor)
                .balance(auctionEngine.getEscrowBalance(id, actor))
                .build());
    }

    private AuctionResponse toResponse(AuctionItem auction) {
        return auctionMapper.toResponse(
                auction,
                auctionEngine.getHighestBid(auction.getId()),
                auctionEngine.getBidCount(auction.getId()));
    }
}
