package com.auctionvault.observability;

import com.auctionvault.event.AuctionEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers the engine's Micrometer meters.
 * <ul>
 *   <li><b>auctions.created</b>, <b>auctions.ended</b>, <b>auctions.canceled</b> (counters)</li>
 *   <li><b>bids.placed</b> (counter)</li>
 *   <li><b>escrow.withdrawn</b> (counter): successful escrow withdrawals</li>
 *   <li><b>auctions.active</b>, <b>auctions.volume</b> (gauges over {@link MetricsAggregator})</li>
 * </ul>
 *
 * <p>Counters follow committed AuctionEvents; gauges are polled by Micrometer on scrape.
 */
@Service
public class CustomMetricsService {

    private final Counter auctionsCreatedCounter;
    private final Counter bidsPlacedCounter;
    private final Counter auctionsEndedCounter;
    private final Counter auctionsCanceledCounter;
    private final Counter escrowWithdrawnCounter;

    public CustomMetricsService(MeterRegistry meterRegistry, MetricsAggregator metricsAggregator) {
        this.auctionsCreatedCounter = Counter.builder("auctions.created")
                .description("Auctions created")
                .register(meterRegistry);
        this.bidsPlacedCounter = Counter.builder("bids.placed")
                .description("Bids accepted")
                .register(meterRegistry);
        this.auctionsEndedCounter = Counter.builder("auctions.ended")
                .description("Auctions settled by explicit end or buy-now")
                .register(meterRegistry);
        this.auctionsCanceledCounter = Counter.builder("auctions.canceled")
                .description("Auctions canceled")
                .register(meterRegistry);
        this.escrowWithdrawnCounter = Counter.builder("escrow.withdrawn")
                .description("Escrow withdrawals paid out")
                .register(meterRegistry);

        meterRegistry.gauge("auctions.active", metricsAggregator, aggregator -> aggregator.snapshot()
                .getActiveAuctions());
        meterRegistry.gauge("auctions.volume", metricsAggregator, aggregator -> aggregator.snapshot()
                .getTotalVolume()
                .doubleValue());
    }

    @EventListener
    @Order(20)
    public void onAuctionEvent(AuctionEvent event) {
        switch (event.getEventType()) {
            case CREATED -> auctionsCreatedCounter.increment();
            case BID_PLACED -> bidsPlacedCounter.increment();
            case ENDED -> auctionsEndedCounter.increment();
            case CANCELED -> auctionsCanceledCounter.increment();
            case BID_WITHDRAWN -> escrowWithdrawnCounter.increment();
            default -> {}
        }
    }
}
