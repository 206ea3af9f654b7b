package com.auctionvault.config;

import com.auctionvault.core.engine.EngineSettings;
import com.auctionvault.domain.enums.Role;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link EngineSettings} bean from application.yml and the {@link Clock}
 * the HTTP layer uses to stamp requests.
 *
 * <p>Properties prefix: {@code auctionvault.*}. Role members are comma-separated actor
 * ids; blank means none beyond the admin.
 */
@Configuration
public class EngineConfig {

    @Bean
    public EngineSettings engineSettings(
            @Value("${auctionvault.admin-id}") String adminId,
            @Value("${auctionvault.native-asset:NATIVE}") String nativeAsset,
            @Value("${auctionvault.fee.platform-percentage:0}") BigDecimal platformFeePercentage,
            @Value("${auctionvault.fee.max-percentage:10}") BigDecimal maxFeePercentage,
            @Value("${auctionvault.throttle.rate-limit-period:1h}") Duration rateLimitPeriod,
            @Value("${auctionvault.throttle.max-actions-per-period:100}") int maxActionsPerPeriod,
            @Value("${auctionvault.throttle.action-cooldown:60s}") Duration actionCooldown,
            @Value("${auctionvault.roles.auctioneers:}") String auctioneers,
            @Value("${auctionvault.roles.operators:}") String operators,
            @Value("${auctionvault.roles.maintainers:}") String maintainers,
            @Value("${auctionvault.roles.recovery:}") String recovery) {
        Map<Role, Set<String>> members = new EnumMap<>(Role.class);
        members.put(Role.AUCTIONEER, parseMembers(auctioneers));
        members.put(Role.OPERATOR, parseMembers(operators));
        members.put(Role.MAINTAINER, parseMembers(maintainers));
        members.put(Role.RECOVERY, parseMembers(recovery));

        return EngineSettings.builder()
                .adminId(adminId)
                .nativeAsset(nativeAsset)
                .platformFeePercentage(platformFeePercentage)
                .maxFeePercentage(maxFeePercentage)
                .rateLimitPeriod(rateLimitPeriod)
                .maxActionsPerPeriod(maxActionsPerPeriod)
                .actionCooldown(actionCooldown)
                .initialRoleMembers(members)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static Set<String> parseMembers(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
