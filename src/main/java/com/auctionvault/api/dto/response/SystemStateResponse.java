package com.auctionvault.api.dto.response;

import java.math.BigDecimal;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SystemStateResponse {

    private String state;
    private boolean paused;
    private BigDecimal platformFeePercentage;
    private Set<String> blacklistedBidders;
}
