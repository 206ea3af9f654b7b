package com.auctionvault.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * New platform fee in percent. Range is checked by the engine against the configured maximum.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeeUpdateRequest {

    @NotNull(message = "Percentage is required")
    private BigDecimal percentage;
}
