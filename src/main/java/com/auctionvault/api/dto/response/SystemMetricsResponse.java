package com.auctionvault.api.dto.response;

import java.math.BigDecimal;
import java.time.Instant;
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
public class SystemMetricsResponse {

    private long totalAuctions;
    private long activeAuctions;
    private BigDecimal totalVolume;
    private Instant lastUpdateTimestamp;
}
