package com.auctionvault.core.engine;

import com.auctionvault.domain.enums.Role;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/**
 * Construction-time configuration of the engine.
 *
 * <p>The admin identity receives every role at startup. {@code initialRoleMembers} adds
 * further members per role; later changes go through the ADMIN-gated role operations.
 */
@Data
@Builder
public class EngineSettings {

    public static final String DEFAULT_NATIVE_ASSET = "NATIVE";

    private String adminId;

    @Builder.Default
    private Map<Role, Set<String>> initialRoleMembers = new EnumMap<>(Role.class);

    /** Fee taken from the final price at settlement, in percent. */
    @Builder.Default
    private BigDecimal platformFeePercentage = BigDecimal.ZERO;

    /** Upper bound accepted by setPlatformFee, in percent. */
    @Builder.Default
    private BigDecimal maxFeePercentage = BigDecimal.TEN;

    @Builder.Default
    private Duration rateLimitPeriod = Duration.ofHours(1);

    @Builder.Default
    private int maxActionsPerPeriod = 100;

    /** Minimum interval between two accepted bids of the same actor. */
    @Builder.Default
    private Duration actionCooldown = Duration.ofMinutes(1);

    /** Payment asset sentinel meaning the native currency. */
    @Builder.Default
    private String nativeAsset = DEFAULT_NATIVE_ASSET;

    public boolean isNative(String paymentAsset) {
        return nativeAsset.equals(paymentAsset);
    }
}
