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
public class BidResponse {

    private long auctionId;
    private int index;
    private String bidder;
    private BigDecimal amount;
    private Instant timestamp;
    private boolean withdrawn;
}
