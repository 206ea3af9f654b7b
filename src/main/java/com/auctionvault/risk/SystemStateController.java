package com.auctionvault.risk;

import com.auctionvault.auth.AccessControlService;
import com.auctionvault.domain.enums.Role;
import com.auctionvault.domain.enums.SystemState;
import com.auctionvault.domain.model.SystemStatus;
import com.auctionvault.event.AlertLevel;
import com.auctionvault.event.EventPublisherHelper;
import com.auctionvault.event.SystemEventType;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Global circuit breaker.
 *
 * <p>State and pause flag are independent:
 * <ul>
 *   <li>emergency on: state EMERGENCY, paused</li>
 *   <li>emergency off: state ACTIVE, unpaused, whatever maintenance had set</li>
 *   <li>maintenance toggles ACTIVE and MAINTENANCE and never touches the pause flag</li>
 * </ul>
 * Auction creation and bidding require both {@code !paused} and {@code state == ACTIVE}.
 * Ending, cancelling and withdrawing are never gated here, so funds stay reachable
 * during an incident.
 */
@Service
public class SystemStateController {

    private static final Logger log = LoggerFactory.getLogger(SystemStateController.class);

    private final AccessControlService accessControlService;
    private final EventPublisherHelper eventPublisherHelper;

    private SystemState state = SystemState.ACTIVE;
    private boolean paused;

    public SystemStateController(
            AccessControlService accessControlService, EventPublisherHelper eventPublisherHelper) {
        this.accessControlService = accessControlService;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * @throws AuctionException EMERGENCY_PAUSED if paused, INVALID_SYSTEM_STATE if the
     *     state is not ACTIVE
     */
    public synchronized void assertOperable() {
        if (paused) {
            throw new AuctionException(ErrorCode.EMERGENCY_PAUSED, "System is paused by emergency stop");
        }
        if (state != SystemState.ACTIVE) {
            throw new AuctionException(
                    ErrorCode.INVALID_SYSTEM_STATE,
                    "System is in " + state + " state",
                    Map.of("state", state.name()));
        }
    }

    public void setEmergencyState(String caller, boolean enable, Instant now) {
        accessControlService.requireRole(caller, Role.ADMIN);
        SystemState previous;
        SystemState next;
        synchronized (this) {
            previous = state;
            next = enable ? SystemState.EMERGENCY : SystemState.ACTIVE;
            state = next;
            paused = enable;
        }

        if (enable) {
            log.error("EMERGENCY STOP engaged by '{}' (was {})", caller, previous);
        } else {
            log.info("Emergency stop lifted by '{}' (was {})", caller, previous);
        }
        Map<String, Object> details = Map.of("from", previous.name(), "to", next.name(), "paused", enable);
        eventPublisherHelper.publishSystemEvent(
                this, SystemEventType.SYSTEM_STATE_CHANGED, caller, "System state " + previous + " -> " + next, now, details);
        eventPublisherHelper.publishSystemEvent(
                this,
                SystemEventType.EMERGENCY_ACTION,
                caller,
                enable ? "Emergency stop engaged" : "Emergency stop lifted",
                now,
                details);
        if (enable) {
            eventPublisherHelper.publishSecurityAlert(
                    this, AlertLevel.CRITICAL, caller, "Emergency stop engaged", now, details);
        }
    }

    public void setMaintenanceMode(String caller, boolean enable, Instant now) {
        accessControlService.requireRole(caller, Role.MAINTAINER);
        SystemState previous;
        SystemState next;
        synchronized (this) {
            previous = state;
            next = enable ? SystemState.MAINTENANCE : SystemState.ACTIVE;
            state = next;
        }

        log.info("Maintenance mode {} by '{}' (state {} -> {})", enable ? "enabled" : "disabled", caller, previous, next);
        eventPublisherHelper.publishSystemEvent(
                this,
                SystemEventType.SYSTEM_STATE_CHANGED,
                caller,
                "System state " + previous + " -> " + next,
                now,
                Map.of("from", previous.name(), "to", next.name(), "paused", isPaused()));
    }

    public synchronized SystemStatus getStatus() {
        return new SystemStatus(state, paused);
    }

    public synchronized SystemState getState() {
        return state;
    }

    public synchronized boolean isPaused() {
        return paused;
    }
}
