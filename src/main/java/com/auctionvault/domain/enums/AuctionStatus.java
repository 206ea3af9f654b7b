package com.auctionvault.domain.enums;

/**
 * Lifecycle of an auction. ENDED and CANCELED are terminal.
 */
public enum AuctionStatus {
    ACTIVE,
    ENDED,
    CANCELED
}
