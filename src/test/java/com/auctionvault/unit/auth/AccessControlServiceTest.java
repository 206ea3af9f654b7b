package com.auctionvault.unit.auth;

import static com.auctionvault.support.ErrorAssertions.assertFails;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.auctionvault.auth.AccessControlService;
import com.auctionvault.core.engine.EngineSettings;
import com.auctionvault.domain.enums.Role;
import com.auctionvault.event.AlertLevel;
import com.auctionvault.event.EventPublisherHelper;
import com.auctionvault.exception.ErrorCode;
import com.auctionvault.exception.UnauthorizedException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for AccessControlService: seeding, role checks, grant/revoke and the
 * last-admin guard.
 */
@ExtendWith(MockitoExtension.class)
class AccessControlServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private AccessControlService accessControl;

    @BeforeEach
    void setUp() {
        Map<Role, Set<String>> members = new EnumMap<>(Role.class);
        members.put(Role.AUCTIONEER, Set.of("auctioneer"));
        members.put(Role.OPERATOR, Set.of("auctioneer", "operator"));
        accessControl = new AccessControlService(
                EngineSettings.builder().adminId("admin").initialRoleMembers(members).build(), eventPublisherHelper);
    }

    @Nested
    @DisplayName("Seeding")
    class Seeding {

        @Test
        @DisplayName("admin holds every role, members hold theirs")
        void seeded() {
            assertThat(accessControl.rolesOf("admin")).containsExactlyInAnyOrderElementsOf(EnumSet.allOf(Role.class));
            assertThat(accessControl.rolesOf("auctioneer")).containsExactlyInAnyOrder(Role.AUCTIONEER, Role.OPERATOR);
            assertThat(accessControl.membersOf(Role.OPERATOR)).containsExactly("admin", "auctioneer", "operator");
            assertThat(accessControl.hasRole(null, Role.ADMIN)).isFalse();
        }

        @Test
        @DisplayName("a missing admin id is a configuration error")
        void requiresAdmin() {
            assertThatThrownBy(() -> new AccessControlService(EngineSettings.builder().build(), eventPublisherHelper))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("requireRole throws UnauthorizedException for non-members")
        void requireRole() {
            assertThatThrownBy(() -> accessControl.requireRole("operator", Role.RECOVERY))
                    .isInstanceOf(UnauthorizedException.class)
                    .hasMessageContaining("RECOVERY");
        }
    }

    @Nested
    @DisplayName("Grant and revoke")
    class GrantRevoke {

        @Test
        @DisplayName("admin grants a role and an INFO alert is raised")
        void grant() {
            accessControl.grantRole("admin", "alice", Role.RECOVERY, NOW);

            assertThat(accessControl.hasRole("alice", Role.RECOVERY)).isTrue();
            verify(eventPublisherHelper)
                    .publishSecurityAlert(
                            eq(accessControl), eq(AlertLevel.INFO), eq("admin"), anyString(), eq(NOW), anyMap());
        }

        @Test
        @DisplayName("granting a held role is a silent no-op")
        void grantIdempotent() {
            accessControl.grantRole("admin", "operator", Role.OPERATOR, NOW);

            verify(eventPublisherHelper, never()).publishSecurityAlert(any(), any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("non-admins cannot grant")
        void grantRequiresAdmin() {
            assertFails(() -> accessControl.grantRole("operator", "alice", Role.OPERATOR, NOW), ErrorCode.UNAUTHORIZED);
            assertFails(() -> accessControl.grantRole("admin", " ", Role.OPERATOR, NOW), ErrorCode.BAD_REQUEST);
        }

        @Test
        @DisplayName("revoke removes only the named role")
        void revoke() {
            accessControl.revokeRole("admin", "auctioneer", Role.OPERATOR, NOW);

            assertThat(accessControl.rolesOf("auctioneer")).containsExactly(Role.AUCTIONEER);
            verify(eventPublisherHelper)
                    .publishSecurityAlert(
                            eq(accessControl), eq(AlertLevel.WARNING), eq("admin"), anyString(), eq(NOW), anyMap());
        }

        @Test
        @DisplayName("the last ADMIN cannot be revoked, a second one can")
        void lastAdminGuard() {
            assertFails(() -> accessControl.revokeRole("admin", "admin", Role.ADMIN, NOW), ErrorCode.BAD_REQUEST);

            accessControl.grantRole("admin", "deputy", Role.ADMIN, NOW);
            accessControl.revokeRole("deputy", "admin", Role.ADMIN, NOW);

            assertThat(accessControl.hasRole("admin", Role.ADMIN)).isFalse();
            assertThat(accessControl.hasRole("admin", Role.RECOVERY)).isTrue();
            assertThat(accessControl.membersOf(Role.ADMIN)).containsExactly("deputy");
        }
    }
}
