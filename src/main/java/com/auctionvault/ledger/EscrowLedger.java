package com.auctionvault.ledger;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Amounts owed to bidders per auction: (auctionId, bidder) to amount.
 *
 * <p>Mutated only under the auction's lock. An entry grows when its bidder is outbid
 * (or when the auction is canceled under their highest bid) and is emptied by
 * {@link #zero} before the payout is attempted.
 */
@Component
public class EscrowLedger {

    private final Map<Long, Map<String, BigDecimal>> entries = new ConcurrentHashMap<>();

    public void credit(long auctionId, String bidder, BigDecimal amount) {
        if (amount.signum() <= 0) {
            return;
        }
        entries.computeIfAbsent(auctionId, id -> new ConcurrentHashMap<>()).merge(bidder, amount, BigDecimal::add);
    }

    public BigDecimal balanceOf(long auctionId, String bidder) {
        Map<String, BigDecimal> auctionEntries = entries.get(auctionId);
        if (auctionEntries == null || bidder == null) {
            return BigDecimal.ZERO;
        }
        return auctionEntries.getOrDefault(bidder, BigDecimal.ZERO);
    }

    /**
     * Clears the entry and returns what it held.
     */
    public BigDecimal zero(long auctionId, String bidder) {
        Map<String, BigDecimal> auctionEntries = entries.get(auctionId);
        if (auctionEntries == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal previous = auctionEntries.remove(bidder);
        return previous != null ? previous : BigDecimal.ZERO;
    }

    /** Puts back an amount taken by {@link #zero} whose payout failed. */
    public void restore(long auctionId, String bidder, BigDecimal amount) {
        credit(auctionId, bidder, amount);
    }
}
