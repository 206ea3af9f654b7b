package com.auctionvault.domain.enums;

/**
 * Direction of a settlement instruction relative to the engine's custody.
 */
public enum TransferType {

    /** Take an auctioned asset from its owner into custody. */
    CUSTODY,

    /** Pay out of custody to a party. */
    RELEASE,

    /** Pull bid funds from a bidder into custody. */
    PULL
}
