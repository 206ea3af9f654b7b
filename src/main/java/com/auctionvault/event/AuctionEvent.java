package com.auctionvault.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published after an auction-scoped operation has committed.
 *
 * <p>{@code actor} and {@code amount} depend on the type: the bidder and bid amount for
 * BID_PLACED, the winner and the final price for ENDED, the withdrawing bidder and the
 * amount paid for BID_WITHDRAWN, the owner and reserve price for CREATED.
 */
public class AuctionEvent extends ApplicationEvent {

    private final AuctionEventType eventType;
    private final long auctionId;
    private final String actor;
    private final BigDecimal amount;
    private final Instant occurredAt;
    private final Map<String, Object> details;

    public AuctionEvent(
            Object source,
            AuctionEventType eventType,
            long auctionId,
            String actor,
            BigDecimal amount,
            Instant occurredAt) {
        this(source, eventType, auctionId, actor, amount, occurredAt, null);
    }

    public AuctionEvent(
            Object source,
            AuctionEventType eventType,
            long auctionId,
            String actor,
            BigDecimal amount,
            Instant occurredAt,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.auctionId = auctionId;
        this.actor = actor;
        this.amount = amount;
        this.occurredAt = occurredAt;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public AuctionEventType getEventType() {
        return eventType;
    }

    public long getAuctionId() {
        return auctionId;
    }

    public String getActor() {
        return actor;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    /**
     * Type-specific details. For example:
     * <ul>
     *   <li>EXTENDED: {"newEndTime": "...", "extensionCount": 3}</li>
     *   <li>ENDED: {"owner": "alice", "proceeds": 97.5, "fee": 2.5, "trigger": "BUY_NOW"}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
