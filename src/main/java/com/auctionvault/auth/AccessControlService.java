package com.auctionvault.auth;

import com.auctionvault.core.engine.EngineSettings;
import com.auctionvault.domain.enums.Role;
import com.auctionvault.event.AlertLevel;
import com.auctionvault.event.EventPublisherHelper;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import com.auctionvault.exception.UnauthorizedException;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Role membership for every actor known to the engine.
 *
 * <p>Seeded once from {@link EngineSettings}: the admin holds every role and the
 * configured members hold theirs. After that, only an ADMIN can grant or revoke, and
 * the last ADMIN membership cannot be revoked so the engine can never lock itself out
 * of emergency controls.
 *
 * <p>Role sets are replaced copy-on-write, so {@link #hasRole} never blocks.
 */
@Service
public class AccessControlService {

    private static final Logger log = LoggerFactory.getLogger(AccessControlService.class);

    private final Map<String, Set<Role>> roles = new ConcurrentHashMap<>();
    private final EventPublisherHelper eventPublisherHelper;

    public AccessControlService(EngineSettings engineSettings, EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
        if (engineSettings.getAdminId() == null || engineSettings.getAdminId().isBlank()) {
            throw new IllegalArgumentException("Engine admin id must be configured");
        }
        roles.put(engineSettings.getAdminId(), Collections.unmodifiableSet(EnumSet.allOf(Role.class)));
        engineSettings.getInitialRoleMembers().forEach((role, members) -> members.forEach(actor -> add(actor, role)));
        log.info("Access control initialised: admin={}, actors with roles={}", engineSettings.getAdminId(), roles.size());
    }

    /**
     * @throws UnauthorizedException if {@code actor} does not hold {@code role}
     */
    public void requireRole(String actor, Role role) {
        if (!hasRole(actor, role)) {
            log.warn("Actor '{}' lacks role {}", actor, role);
            throw new UnauthorizedException(
                    "Actor '" + actor + "' does not hold role " + role, Map.of("actor", nullSafe(actor), "role", role));
        }
    }

    public boolean hasRole(String actor, Role role) {
        if (actor == null) {
            return false;
        }
        return roles.getOrDefault(actor, Set.of()).contains(role);
    }

    public Set<Role> rolesOf(String actor) {
        return roles.getOrDefault(actor, Set.of());
    }

    /** Actors currently holding {@code role}, sorted. */
    public Set<String> membersOf(Role role) {
        Set<String> members = new TreeSet<>();
        roles.forEach((actor, held) -> {
            if (held.contains(role)) {
                members.add(actor);
            }
        });
        return members;
    }

    public synchronized void grantRole(String caller, String actor, Role role, Instant now) {
        requireRole(caller, Role.ADMIN);
        if (actor == null || actor.isBlank()) {
            throw new AuctionException(ErrorCode.BAD_REQUEST, "Actor id is required");
        }
        if (hasRole(actor, role)) {
            return;
        }
        add(actor, role);
        log.info("Role {} granted to '{}' by '{}'", role, actor, caller);
        eventPublisherHelper.publishSecurityAlert(
                this,
                AlertLevel.INFO,
                caller,
                "Role " + role + " granted to " + actor,
                now,
                Map.of("target", actor, "role", role.name(), "change", "GRANT"));
    }

    public synchronized void revokeRole(String caller, String actor, Role role, Instant now) {
        requireRole(caller, Role.ADMIN);
        if (!hasRole(actor, role)) {
            return;
        }
        if (role == Role.ADMIN && membersOf(Role.ADMIN).size() == 1) {
            throw new AuctionException(ErrorCode.BAD_REQUEST, "Cannot revoke the last ADMIN membership");
        }
        roles.computeIfPresent(actor, (key, held) -> {
            EnumSet<Role> next = EnumSet.copyOf(held);
            next.remove(role);
            return next.isEmpty() ? null : Collections.unmodifiableSet(next);
        });
        log.warn("Role {} revoked from '{}' by '{}'", role, actor, caller);
        eventPublisherHelper.publishSecurityAlert(
                this,
                AlertLevel.WARNING,
                caller,
                "Role " + role + " revoked from " + actor,
                now,
                Map.of("target", actor, "role", role.name(), "change", "REVOKE"));
    }

    private void add(String actor, Role role) {
        roles.compute(actor, (key, held) -> {
            EnumSet<Role> next = held == null || held.isEmpty() ? EnumSet.noneOf(Role.class) : EnumSet.copyOf(held);
            next.add(role);
            return Collections.unmodifiableSet(next);
        });
    }

    private String nullSafe(String value) {
        return value != null ? value : "";
    }
}
