package com.auctionvault.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Capabilities an actor can hold. Membership is additive: an actor may hold any subset.
 */
@Getter
@RequiredArgsConstructor
public enum Role {
    ADMIN("Emergency state, platform fee, role grants"),
    AUCTIONEER("Cancel any auction"),
    OPERATOR("Bidder blacklist moderation"),
    MAINTAINER("Maintenance mode"),
    RECOVERY("Recover free treasury balances");

    private final String description;
}
