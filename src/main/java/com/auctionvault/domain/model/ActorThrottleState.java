package com.auctionvault.domain.model;

import java.time.Instant;
import lombok.Data;

/**
 * Per-actor throttle record shared by the rate limiter and the cooldown guard.
 * Created lazily on an actor's first gated action and kept for the process lifetime.
 */
@Data
public class ActorThrottleState {

    private Instant windowStart;
    private int actionCount;

    /** Time of the actor's last accepted bid; null until the first one. */
    private Instant lastBidTime;
}
