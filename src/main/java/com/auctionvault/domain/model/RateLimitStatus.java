package com.auctionvault.domain.model;

import java.time.Instant;
import lombok.Value;

@Value
public class RateLimitStatus {

    int actionsRemaining;

    /** When the actor may bid again; null if the actor has never bid. */
    Instant cooldownEnds;
}
