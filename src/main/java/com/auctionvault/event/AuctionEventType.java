package com.auctionvault.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Classifies the auction state transition carried by an {@link AuctionEvent}.
 * {@code eventName} is the stable name written to the event log.
 */
@Getter
@RequiredArgsConstructor
public enum AuctionEventType {

    /** Auction registered and asset taken into custody. */
    CREATED("AuctionCreated"),

    /** Bid accepted and now leading. */
    BID_PLACED("BidPlaced"),

    /** A bid inside the extension window pushed endTime back. */
    EXTENDED("AuctionExtended"),

    /** Settled: asset to the winner, proceeds to the owner. */
    ENDED("AuctionEnded"),

    /** Canceled by its owner or an auctioneer. */
    CANCELED("AuctionCanceled"),

    /** An outbid bidder withdrew their escrow. */
    BID_WITHDRAWN("BidWithdrawn");

    private final String eventName;
}
