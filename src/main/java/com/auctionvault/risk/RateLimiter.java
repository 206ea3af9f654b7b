package com.auctionvault.risk;

import com.auctionvault.core.engine.EngineSettings;
import com.auctionvault.domain.model.ActorThrottleState;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fixed-window action throttle per actor.
 *
 * <p>For an action at time t:
 * <ul>
 *   <li>inside the current window (t &lt; windowStart + period): rejected once the count
 *       has reached the cap, otherwise counted;</li>
 *   <li>otherwise a new window starts at t with a count of 1.</li>
 * </ul>
 * The action that opens a new window is never charged to the expired one.
 *
 * <p>Checking and recording are split: {@link #evaluate} is pure and returns the window
 * to store, {@link #commit} stores it once the whole operation has succeeded. A rejected
 * operation therefore never consumes quota. Both require the actor's throttle lock.
 */
@Service
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final ActorThrottleRegistry actorThrottleRegistry;
    private final Duration period;
    private final int maxActions;

    public RateLimiter(ActorThrottleRegistry actorThrottleRegistry, EngineSettings engineSettings) {
        this.actorThrottleRegistry = actorThrottleRegistry;
        this.period = engineSettings.getRateLimitPeriod();
        this.maxActions = engineSettings.getMaxActionsPerPeriod();
    }

    /**
     * @return the window the actor will have after this action
     * @throws AuctionException RATE_LIMIT_EXCEEDED if the current window is full
     */
    public RateWindow evaluate(String actor, Instant now) {
        ActorThrottleState state = actorThrottleRegistry.peek(actor);
        if (state != null && state.getWindowStart() != null && isInWindow(state, now)) {
            if (state.getActionCount() >= maxActions) {
                Instant resetsAt = state.getWindowStart().plus(period);
                log.warn("Rate limit exceeded for '{}': {} actions since {}", actor, maxActions, state.getWindowStart());
                throw new AuctionException(
                        ErrorCode.RATE_LIMIT_EXCEEDED,
                        "Rate limit of " + maxActions + " actions per " + period + " exceeded",
                        Map.of("actor", actor, "windowResetsAt", resetsAt.toString()));
            }
            return new RateWindow(state.getWindowStart(), state.getActionCount() + 1);
        }
        return new RateWindow(now, 1);
    }

    public void commit(String actor, RateWindow window) {
        ActorThrottleState state = actorThrottleRegistry.stateOf(actor);
        state.setWindowStart(window.windowStart());
        state.setActionCount(window.actionCount());
    }

    /** Actions the actor could still perform at {@code now} before being throttled. */
    public int actionsRemaining(String actor, Instant now) {
        ActorThrottleState state = actorThrottleRegistry.peek(actor);
        if (state == null || state.getWindowStart() == null || !isInWindow(state, now)) {
            return maxActions;
        }
        return Math.max(0, maxActions - state.getActionCount());
    }

    private boolean isInWindow(ActorThrottleState state, Instant now) {
        return now.isBefore(state.getWindowStart().plus(period));
    }

    /** Window start and count to record for an actor. */
    public record RateWindow(Instant windowStart, int actionCount) {}
}
