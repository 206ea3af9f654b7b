package com.auctionvault.api.dto.response;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST view of an auction together with its current leader.
 * {@code highestBidder} is null until the first accepted bid, and again after cancellation.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuctionResponse {

    private long id;
    private String assetId;
    private String paymentAsset;
    private String owner;
    private BigDecimal reservePrice;
    private BigDecimal buyNowPrice;
    private BigDecimal minimumBidIncrement;
    private long timeExtensionSeconds;
    private long extensionWindowSeconds;
    private BigDecimal feePercentage;
    private Instant createdAt;
    private Instant endTime;
    private Instant closedAt;
    private int extensionCount;
    private String status;
    private String highestBidder;
    private BigDecimal highestBid;
    private int bidCount;
}
