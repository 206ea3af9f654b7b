package com.auctionvault.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Classifies engine-wide administrative events carried by a {@link SystemEvent}.
 */
@Getter
@RequiredArgsConstructor
public enum SystemEventType {

    /** Mode or pause flag changed. */
    SYSTEM_STATE_CHANGED("SystemStateChanged"),

    /** Emergency toggled or funds recovered from the treasury. */
    EMERGENCY_ACTION("EmergencyAction"),

    /** Platform fee percentage changed. */
    FEE_UPDATED("FeeUpdated"),

    /** Bidder added to or removed from the blacklist. */
    BIDDER_BLACKLISTED("BidderBlacklisted");

    private final String eventName;
}
