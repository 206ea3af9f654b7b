package com.auctionvault.domain.enums;

/**
 * Global operating mode of the engine. Bidding and auction creation require ACTIVE
 * (and, independently, that the pause flag is clear).
 */
public enum SystemState {
    ACTIVE,
    MAINTENANCE,
    EMERGENCY
}
