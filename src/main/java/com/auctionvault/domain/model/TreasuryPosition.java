package com.auctionvault.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Funds of one asset in the engine's custody. {@code held} is everything received and
 * not yet paid out; {@code owed} is the part that belongs to someone (escrow entries,
 * highest bids of live auctions, custodied auction assets).
 */
@Value
public class TreasuryPosition {

    String asset;
    BigDecimal held;
    BigDecimal owed;

    public static TreasuryPosition empty(String asset) {
        return new TreasuryPosition(asset, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    /** Funds no one has a claim on, the only part recovery may take. */
    public BigDecimal getRecoverable() {
        return held.subtract(owed).max(BigDecimal.ZERO);
    }
}
