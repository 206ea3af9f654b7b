package com.auctionvault.unit.risk;

import static com.auctionvault.support.ErrorAssertions.assertFails;
import static org.assertj.core.api.Assertions.assertThat;

import com.auctionvault.core.engine.EngineSettings;
import com.auctionvault.exception.ErrorCode;
import com.auctionvault.risk.ActorThrottleRegistry;
import com.auctionvault.risk.RateLimiter;
import com.auctionvault.risk.RateLimiter.RateWindow;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RateLimiter: window opening, cap enforcement, reset and the
 * evaluate/commit split.
 */
class RateLimiterTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private ActorThrottleRegistry registry;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        registry = new ActorThrottleRegistry();
        EngineSettings settings = EngineSettings.builder()
                .adminId("admin")
                .rateLimitPeriod(Duration.ofMinutes(10))
                .maxActionsPerPeriod(3)
                .build();
        rateLimiter = new RateLimiter(registry, settings);
    }

    private void act(String actor, Instant now) {
        rateLimiter.commit(actor, rateLimiter.evaluate(actor, now));
    }

    @Nested
    @DisplayName("Window accounting")
    class WindowAccounting {

        @Test
        @DisplayName("first action opens a window with count 1")
        void firstActionOpensWindow() {
            RateWindow window = rateLimiter.evaluate("alice", START);

            assertThat(window.windowStart()).isEqualTo(START);
            assertThat(window.actionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("evaluate alone consumes no quota")
        void evaluateIsPure() {
            rateLimiter.evaluate("alice", START);
            rateLimiter.evaluate("alice", START);

            assertThat(rateLimiter.actionsRemaining("alice", START)).isEqualTo(3);
            assertThat(registry.peek("alice")).isNull();
        }

        @Test
        @DisplayName("committed actions inside the window count towards the cap")
        void countsInsideWindow() {
            act("alice", START);
            act("alice", START.plusSeconds(60));

            assertThat(rateLimiter.actionsRemaining("alice", START.plusSeconds(120))).isEqualTo(1);
            assertThat(rateLimiter.evaluate("alice", START.plusSeconds(120)).windowStart()).isEqualTo(START);
        }
    }

    @Nested
    @DisplayName("Cap enforcement")
    class CapEnforcement {

        @Test
        @DisplayName("action beyond the cap fails with RATE_LIMIT_EXCEEDED")
        void rejectsBeyondCap() {
            act("alice", START);
            act("alice", START);
            act("alice", START);

            assertFails(() -> rateLimiter.evaluate("alice", START.plusSeconds(599)), ErrorCode.RATE_LIMIT_EXCEEDED);
            assertThat(rateLimiter.actionsRemaining("alice", START)).isZero();
        }

        @Test
        @DisplayName("the action at windowStart + period opens a fresh window")
        void resetsAtBoundary() {
            act("alice", START);
            act("alice", START);
            act("alice", START);

            Instant boundary = START.plus(Duration.ofMinutes(10));
            RateWindow window = rateLimiter.evaluate("alice", boundary);

            assertThat(window.windowStart()).isEqualTo(boundary);
            assertThat(window.actionCount()).isEqualTo(1);
            assertThat(rateLimiter.actionsRemaining("alice", boundary)).isEqualTo(3);
        }

        @Test
        @DisplayName("one actor's usage does not affect another")
        void independentActors() {
            act("alice", START);
            act("alice", START);
            act("alice", START);

            assertThat(rateLimiter.evaluate("bob", START).actionCount()).isEqualTo(1);
        }
    }
}
