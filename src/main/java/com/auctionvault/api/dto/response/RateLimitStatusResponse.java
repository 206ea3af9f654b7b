package com.auctionvault.api.dto.response;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Throttle status of one actor. {@code cooldownEnds} is null if the actor has never bid.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RateLimitStatusResponse {

    private String actor;
    private int actionsRemaining;
    private Instant cooldownEnds;
}
