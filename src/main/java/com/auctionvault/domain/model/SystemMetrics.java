package com.auctionvault.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time copy of the process-wide rollups.
 */
@Value
@Builder
public class SystemMetrics {

    long totalAuctions;
    long activeAuctions;

    /** Sum of all accepted bid amounts, across payment assets. */
    BigDecimal totalVolume;

    Instant lastUpdateTimestamp;
}
