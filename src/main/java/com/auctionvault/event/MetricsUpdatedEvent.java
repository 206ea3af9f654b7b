package com.auctionvault.event;

import com.auctionvault.domain.model.SystemMetrics;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every commit that changes the system rollups.
 */
public class MetricsUpdatedEvent extends ApplicationEvent {

    private final SystemMetrics metrics;

    public MetricsUpdatedEvent(Object source, SystemMetrics metrics) {
        super(source);
        this.metrics = metrics;
    }

    public SystemMetrics getMetrics() {
        return metrics;
    }
}
