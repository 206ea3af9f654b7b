package com.auctionvault.observability;

import com.auctionvault.domain.model.SystemMetrics;
import java.math.BigDecimal;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Process-wide rollups. Updated only as a side effect of committed engine operations;
 * each mutator returns the snapshot the engine then publishes as MetricsUpdated.
 */
@Component
public class MetricsAggregator {

    private long totalAuctions;
    private long activeAuctions;
    private BigDecimal totalVolume = BigDecimal.ZERO;
    private Instant lastUpdateTimestamp;

    public synchronized SystemMetrics recordAuctionCreated(Instant now) {
        totalAuctions++;
        activeAuctions++;
        lastUpdateTimestamp = now;
        return snapshot();
    }

    /** An auction left the active set, by ending or cancellation. */
    public synchronized SystemMetrics recordAuctionClosed(Instant now) {
        activeAuctions--;
        lastUpdateTimestamp = now;
        return snapshot();
    }

    public synchronized SystemMetrics recordVolume(BigDecimal amount, Instant now) {
        totalVolume = totalVolume.add(amount);
        lastUpdateTimestamp = now;
        return snapshot();
    }

    public synchronized SystemMetrics snapshot() {
        return SystemMetrics.builder()
                .totalAuctions(totalAuctions)
                .activeAuctions(activeAuctions)
                .totalVolume(totalVolume)
                .lastUpdateTimestamp(lastUpdateTimestamp)
                .build();
    }
}
