package com.auctionvault.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Creation parameters of an auction, as supplied by its owner.
 */
@Value
@Builder(toBuilder = true)
public class AuctionTerms {

    String assetId;
    String paymentAsset;
    BigDecimal reservePrice;
    BigDecimal buyNowPrice;
    BigDecimal minimumBidIncrement;
    Duration duration;
    Duration timeExtension;
    Duration extensionWindow;
}
