package com.auctionvault.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Current leader of an auction. {@link #none()} before the first accepted bid.
 */
@Value
public class HighestBid {

    private static final HighestBid NONE = new HighestBid(null, BigDecimal.ZERO);

    String bidder;
    BigDecimal amount;

    public static HighestBid none() {
        return NONE;
    }

    public static HighestBid of(String bidder, BigDecimal amount) {
        return new HighestBid(bidder, amount);
    }

    public boolean isPresent() {
        return bidder != null;
    }
}
