package com.auctionvault.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * In-memory record of the most recent events the engine publishes, for audit and for
 * clients that poll instead of subscribing.
 *
 * <p>Runs first ({@code @Order(1)}) so the log order equals publication order.
 * Consumers read with {@link #after(long)} using the last sequence they saw.
 *
 * <p>Holds at most {@code auctionvault.event-log.capacity} entries; the oldest are
 * evicted once the log is full. Sequence numbers keep counting across evictions, so a
 * consumer that fell behind sees a jump in sequence rather than a repeat.
 */
@Component
public class AuctionEventLog {

    private static final Logger log = LoggerFactory.getLogger(AuctionEventLog.class);

    static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final ConcurrentLinkedDeque<EventLogEntry> entries = new ConcurrentLinkedDeque<>();
    private long lastSequence;
    private int retained;

    public AuctionEventLog(@Value("${auctionvault.event-log.capacity:" + DEFAULT_CAPACITY + "}") int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Event log capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    @EventListener
    @Order(1)
    public void onAuctionEvent(AuctionEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("auctionId", event.getAuctionId());
        putIfPresent(payload, "actor", event.getActor());
        putIfPresent(payload, "amount", event.getAmount());
        payload.putAll(event.getDetails());
        append(event.getEventType().getEventName(), event.getOccurredAt(), payload);
    }

    @EventListener
    @Order(1)
    public void onSystemEvent(SystemEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        putIfPresent(payload, "actor", event.getActor());
        putIfPresent(payload, "message", event.getMessage());
        payload.putAll(event.getDetails());
        append(event.getEventType().getEventName(), event.getOccurredAt(), payload);
    }

    @EventListener
    @Order(1)
    public void onSecurityAlert(SecurityAlertEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("level", event.getLevel().name());
        putIfPresent(payload, "actor", event.getActor());
        putIfPresent(payload, "message", event.getMessage());
        payload.putAll(event.getDetails());
        log.warn("Security alert [{}] by {}: {}", event.getLevel(), event.getActor(), event.getMessage());
        append("SecurityAlert", event.getOccurredAt(), payload);
    }

    @EventListener
    @Order(1)
    public void onMetricsUpdated(MetricsUpdatedEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("totalAuctions", event.getMetrics().getTotalAuctions());
        payload.put("activeAuctions", event.getMetrics().getActiveAuctions());
        payload.put("totalVolume", event.getMetrics().getTotalVolume());
        append("MetricsUpdated", event.getMetrics().getLastUpdateTimestamp(), payload);
    }

    /**
     * Returns entries with a sequence strictly greater than {@code sequence}, oldest first.
     */
    public List<EventLogEntry> after(long sequence) {
        return entries.stream().filter(entry -> entry.getSequence() > sequence).toList();
    }

    public synchronized long size() {
        return retained;
    }

    private synchronized void append(String name, Instant occurredAt, Map<String, Object> payload) {
        EventLogEntry entry = EventLogEntry.builder()
                .sequence(++lastSequence)
                .name(name)
                .occurredAt(occurredAt)
                .payload(Map.copyOf(payload))
                .build();
        entries.addLast(entry);
        if (++retained > capacity) {
            entries.removeFirst();
            retained--;
        }
        log.debug("Event #{} {}: {}", entry.getSequence(), name, payload);
    }

    private void putIfPresent(Map<String, Object> payload, String key, Object value) {
        if (value != null) {
            payload.put(key, value);
        }
    }
}
