package com.auctionvault.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * An accepted bid. Bids are appended per auction and never removed; only the
 * {@code withdrawn} flag changes, once the bidder has withdrawn the escrow that
 * this bid left behind after being outbid.
 */
@Data
@Builder(toBuilder = true)
public class Bid {

    private long auctionId;

    /** Position of this bid in its auction's sequence, from 0. */
    private int index;

    private String bidder;
    private BigDecimal amount;
    private Instant timestamp;
    private boolean withdrawn;

    public Bid copy() {
        return toBuilder().build();
    }
}
