package com.auctionvault.event;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published for administrative transitions: system state, emergency actions, fee
 * changes and blacklist changes. {@code actor} is the administrator who acted.
 */
public class SystemEvent extends ApplicationEvent {

    private final SystemEventType eventType;
    private final String actor;
    private final String message;
    private final Instant occurredAt;
    private final Map<String, Object> details;

    public SystemEvent(
            Object source,
            SystemEventType eventType,
            String actor,
            String message,
            Instant occurredAt,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.actor = actor;
        this.message = message;
        this.occurredAt = occurredAt;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public SystemEventType getEventType() {
        return eventType;
    }

    public String getActor() {
        return actor;
    }

    public String getMessage() {
        return message;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
