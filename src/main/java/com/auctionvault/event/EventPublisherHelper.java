package com.auctionvault.event;

import com.auctionvault.domain.model.AuctionItem;
import com.auctionvault.domain.model.SystemMetrics;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for every event
 * the engine emits.
 *
 * <p>The engine calls these only after an operation has committed, so a listener never
 * observes an event for a change that was rolled back. Delivery is synchronous unless a
 * listener opts into {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Auction ----

    public void publishAuctionCreated(Object source, AuctionItem auction) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("assetId", auction.getAssetId());
        details.put("paymentAsset", auction.getPaymentAsset());
        details.put("buyNowPrice", auction.getBuyNowPrice());
        details.put("endTime", auction.getEndTime().toString());
        applicationEventPublisher.publishEvent(new AuctionEvent(
                source,
                AuctionEventType.CREATED,
                auction.getId(),
                auction.getOwner(),
                auction.getReservePrice(),
                auction.getCreatedAt(),
                details));
    }

    public void publishBidPlaced(Object source, long auctionId, String bidder, BigDecimal amount, Instant now) {
        applicationEventPublisher.publishEvent(
                new AuctionEvent(source, AuctionEventType.BID_PLACED, auctionId, bidder, amount, now));
    }

    public void publishAuctionExtended(Object source, AuctionItem auction, String bidder, Instant now) {
        applicationEventPublisher.publishEvent(new AuctionEvent(
                source,
                AuctionEventType.EXTENDED,
                auction.getId(),
                bidder,
                null,
                now,
                Map.of(
                        "newEndTime", auction.getEndTime().toString(),
                        "extensionCount", auction.getExtensionCount())));
    }

    public void publishAuctionEnded(
            Object source,
            AuctionItem auction,
            String winner,
            BigDecimal price,
            BigDecimal fee,
            String trigger,
            Instant now) {
        applicationEventPublisher.publishEvent(new AuctionEvent(
                source,
                AuctionEventType.ENDED,
                auction.getId(),
                winner,
                price,
                now,
                Map.of(
                        "owner", auction.getOwner(),
                        "proceeds", price.subtract(fee),
                        "fee", fee,
                        "trigger", trigger)));
    }

    public void publishAuctionCanceled(
            Object source, AuctionItem auction, String caller, String refundedBidder, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("owner", auction.getOwner());
        if (refundedBidder != null) {
            details.put("escrowedBidder", refundedBidder);
        }
        applicationEventPublisher.publishEvent(
                new AuctionEvent(source, AuctionEventType.CANCELED, auction.getId(), caller, null, now, details));
    }

    public void publishBidWithdrawn(Object source, long auctionId, String bidder, BigDecimal amount, Instant now) {
        applicationEventPublisher.publishEvent(
                new AuctionEvent(source, AuctionEventType.BID_WITHDRAWN, auctionId, bidder, amount, now));
    }

    // ---- System ----

    public void publishSystemEvent(
            Object source, SystemEventType eventType, String actor, String message, Instant now) {
        applicationEventPublisher.publishEvent(new SystemEvent(source, eventType, actor, message, now, null));
    }

    public void publishSystemEvent(
            Object source,
            SystemEventType eventType,
            String actor,
            String message,
            Instant now,
            Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new SystemEvent(source, eventType, actor, message, now, details));
    }

    // ---- Security ----

    public void publishSecurityAlert(
            Object source, AlertLevel level, String actor, String message, Instant now, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new SecurityAlertEvent(source, level, actor, message, now, details));
    }

    // ---- Metrics ----

    public void publishMetricsUpdated(Object source, SystemMetrics metrics) {
        applicationEventPublisher.publishEvent(new MetricsUpdatedEvent(source, metrics));
    }
}
