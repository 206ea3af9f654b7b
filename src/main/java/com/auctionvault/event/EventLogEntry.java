package com.auctionvault.event;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One record in the {@link AuctionEventLog}. Sequence numbers start at 1 and are
 * assigned without gaps; eviction only drops the oldest.
 */
@Value
@Builder
public class EventLogEntry {

    long sequence;
    String name;
    Instant occurredAt;
    Map<String, Object> payload;
}
