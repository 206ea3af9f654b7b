package com.auctionvault.ledger;

import com.auctionvault.auth.AccessControlService;
import com.auctionvault.core.engine.EngineSettings;
import com.auctionvault.domain.enums.Role;
import com.auctionvault.event.EventPublisherHelper;
import com.auctionvault.event.SystemEventType;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Platform fee, in percent of the final price. Each auction snapshots the current
 * percentage at creation, so a change only applies to auctions created afterwards.
 */
@Service
public class FeePolicy {

    private static final Logger log = LoggerFactory.getLogger(FeePolicy.class);

    private final AccessControlService accessControlService;
    private final EventPublisherHelper eventPublisherHelper;
    private final BigDecimal maxFeePercentage;

    private volatile BigDecimal platformFeePercentage;

    public FeePolicy(
            EngineSettings engineSettings,
            AccessControlService accessControlService,
            EventPublisherHelper eventPublisherHelper) {
        this.accessControlService = accessControlService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.maxFeePercentage = engineSettings.getMaxFeePercentage();
        validate(engineSettings.getPlatformFeePercentage());
        this.platformFeePercentage = engineSettings.getPlatformFeePercentage();
    }

    public void setPlatformFee(String caller, BigDecimal percentage, Instant now) {
        accessControlService.requireRole(caller, Role.ADMIN);
        validate(percentage);
        BigDecimal previous = platformFeePercentage;
        platformFeePercentage = percentage;
        log.info("Platform fee changed by '{}': {}% -> {}%", caller, previous, percentage);
        eventPublisherHelper.publishSystemEvent(
                this,
                SystemEventType.FEE_UPDATED,
                caller,
                "Platform fee " + previous + "% -> " + percentage + "%",
                now,
                Map.of("previous", previous, "current", percentage));
    }

    public BigDecimal getPlatformFeePercentage() {
        return platformFeePercentage;
    }

    public BigDecimal getMaxFeePercentage() {
        return maxFeePercentage;
    }

    /** Fee owed on {@code price} at {@code percentage} percent. */
    public static BigDecimal feeOn(BigDecimal price, BigDecimal percentage) {
        if (percentage == null || percentage.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return price.multiply(percentage).movePointLeft(2);
    }

    private void validate(BigDecimal percentage) {
        if (percentage == null || percentage.signum() < 0 || percentage.compareTo(maxFeePercentage) > 0) {
            throw new AuctionException(
                    ErrorCode.INVALID_FEE_PERCENTAGE,
                    "Fee percentage must be between 0 and " + maxFeePercentage + ": " + percentage);
        }
    }
}
