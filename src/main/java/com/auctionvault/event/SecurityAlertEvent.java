package com.auctionvault.event;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published alongside security-relevant administrative actions so that monitoring can
 * page on them without following every system event.
 *
 * <p>Key producers:
 * <ul>
 *   <li>setEmergencyState(true): CRITICAL</li>
 *   <li>recoverToken, blacklistBidder, revokeRole: WARNING</li>
 *   <li>grantRole, removeFromBlacklist: INFO</li>
 * </ul>
 */
public class SecurityAlertEvent extends ApplicationEvent {

    private final AlertLevel level;
    private final String actor;
    private final String message;
    private final Instant occurredAt;
    private final Map<String, Object> details;

    public SecurityAlertEvent(
            Object source,
            AlertLevel level,
            String actor,
            String message,
            Instant occurredAt,
            Map<String, Object> details) {
        super(source);
        this.level = level;
        this.actor = actor;
        this.message = message;
        this.occurredAt = occurredAt;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public AlertLevel getLevel() {
        return level;
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
