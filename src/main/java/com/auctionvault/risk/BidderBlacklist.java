package com.auctionvault.risk;

import com.auctionvault.auth.AccessControlService;
import com.auctionvault.domain.enums.Role;
import com.auctionvault.event.AlertLevel;
import com.auctionvault.event.EventPublisherHelper;
import com.auctionvault.event.SystemEventType;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Bidders excluded from bidding on any auction. Membership is checked on every bid
 * regardless of amount; it does not affect withdrawals, so a blacklisted bidder can
 * still recover escrow left from before the blacklisting.
 */
@Service
public class BidderBlacklist {

    private static final Logger log = LoggerFactory.getLogger(BidderBlacklist.class);

    private final Map<String, String> reasons = new ConcurrentHashMap<>();
    private final AccessControlService accessControlService;
    private final EventPublisherHelper eventPublisherHelper;

    public BidderBlacklist(AccessControlService accessControlService, EventPublisherHelper eventPublisherHelper) {
        this.accessControlService = accessControlService;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Adds {@code bidder} to the blacklist. Re-blacklisting replaces the reason.
     */
    public void blacklist(String caller, String bidder, String reason, Instant now) {
        accessControlService.requireRole(caller, Role.OPERATOR);
        requireBidder(bidder);
        String recorded = reason != null && !reason.isBlank() ? reason : "unspecified";
        reasons.put(bidder, recorded);
        log.warn("Bidder '{}' blacklisted by '{}': {}", bidder, caller, recorded);

        Map<String, Object> details = Map.of("bidder", bidder, "blacklisted", true, "reason", recorded);
        eventPublisherHelper.publishSystemEvent(
                this, SystemEventType.BIDDER_BLACKLISTED, caller, "Bidder " + bidder + " blacklisted", now, details);
        eventPublisherHelper.publishSecurityAlert(
                this, AlertLevel.WARNING, caller, "Bidder " + bidder + " blacklisted: " + recorded, now, details);
    }

    public void remove(String caller, String bidder, Instant now) {
        accessControlService.requireRole(caller, Role.OPERATOR);
        requireBidder(bidder);
        if (reasons.remove(bidder) == null) {
            throw new AuctionException(ErrorCode.NOT_FOUND, "Bidder '" + bidder + "' is not blacklisted");
        }
        log.info("Bidder '{}' removed from blacklist by '{}'", bidder, caller);
        eventPublisherHelper.publishSystemEvent(
                this,
                SystemEventType.BIDDER_BLACKLISTED,
                caller,
                "Bidder " + bidder + " removed from blacklist",
                now,
                Map.of("bidder", bidder, "blacklisted", false));
    }

    public boolean isBlacklisted(String bidder) {
        return bidder != null && reasons.containsKey(bidder);
    }

    public Set<String> list() {
        return new TreeSet<>(reasons.keySet());
    }

    private void requireBidder(String bidder) {
        if (bidder == null || bidder.isBlank()) {
            throw new AuctionException(ErrorCode.BAD_REQUEST, "Bidder id is required");
        }
    }
}
