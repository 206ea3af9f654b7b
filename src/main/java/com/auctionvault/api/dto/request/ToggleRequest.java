package com.auctionvault.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * On/off switch for emergency stop and maintenance mode.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToggleRequest {

    @NotNull(message = "enabled is required")
    private Boolean enabled;
}
