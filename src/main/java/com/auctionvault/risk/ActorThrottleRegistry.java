package com.auctionvault.risk;

import com.auctionvault.domain.model.ActorThrottleState;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * Owns every actor's {@link ActorThrottleState} and the lock that makes that record
 * single-writer.
 *
 * <p>Callers must hold {@link #lockFor(String)} across the whole check-then-commit of
 * a throttled operation; the rate limiter and cooldown guard assume it.
 */
@Component
public class ActorThrottleRegistry {

    private final ConcurrentHashMap<String, ActorThrottleState> states = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String actor) {
        return locks.computeIfAbsent(actor, key -> new ReentrantLock());
    }

    /** Returns the actor's record, or null if the actor has never performed a gated action. */
    public ActorThrottleState peek(String actor) {
        return states.get(actor);
    }

    /** Returns the actor's record, creating it on first use. */
    public ActorThrottleState stateOf(String actor) {
        return states.computeIfAbsent(actor, key -> new ActorThrottleState());
    }
}
