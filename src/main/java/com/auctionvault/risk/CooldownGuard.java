package com.auctionvault.risk;

import com.auctionvault.core.engine.EngineSettings;
import com.auctionvault.domain.model.ActorThrottleState;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Minimum interval between two accepted bids of the same actor.
 *
 * <p>{@link #check} runs before the bid; {@link #arm} only after it has committed, so a
 * rejected bid never starts a cooldown. Both require the actor's throttle lock.
 */
@Service
public class CooldownGuard {

    private final ActorThrottleRegistry actorThrottleRegistry;
    private final Duration cooldown;

    public CooldownGuard(ActorThrottleRegistry actorThrottleRegistry, EngineSettings engineSettings) {
        this.actorThrottleRegistry = actorThrottleRegistry;
        this.cooldown = engineSettings.getActionCooldown();
    }

    /**
     * @throws AuctionException COOLDOWN_PERIOD if the actor's last bid is too recent
     */
    public void check(String actor, Instant now) {
        Instant ends = cooldownEnds(actor);
        if (ends != null && now.isBefore(ends)) {
            throw new AuctionException(
                    ErrorCode.COOLDOWN_PERIOD,
                    "Bid cooldown active until " + ends,
                    Map.of("actor", actor, "cooldownEnds", ends.toString()));
        }
    }

    public void arm(String actor, Instant now) {
        actorThrottleRegistry.stateOf(actor).setLastBidTime(now);
    }

    /** End of the actor's current cooldown, or null if the actor has never bid. */
    public Instant cooldownEnds(String actor) {
        ActorThrottleState state = actorThrottleRegistry.peek(actor);
        if (state == null || state.getLastBidTime() == null) {
            return null;
        }
        return state.getLastBidTime().plus(cooldown);
    }
}
