package com.auctionvault.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating an auction. Durations are in seconds.
 * The buy-now price must exceed the reserve price; that rule is checked by the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAuctionRequest {

    @NotBlank(message = "Asset id is required")
    private String assetId;

    /** "NATIVE" or a token identifier. */
    @NotBlank(message = "Payment asset is required")
    private String paymentAsset;

    @NotNull(message = "Reserve price is required")
    @PositiveOrZero(message = "Reserve price must not be negative")
    private BigDecimal reservePrice;

    @NotNull(message = "Buy-now price is required")
    @Positive(message = "Buy-now price must be positive")
    private BigDecimal buyNowPrice;

    @NotNull(message = "Minimum bid increment is required")
    @PositiveOrZero(message = "Minimum bid increment must not be negative")
    private BigDecimal minimumBidIncrement;

    @NotNull(message = "Duration is required")
    @Positive(message = "Duration must be positive")
    private Long durationSeconds;

    @PositiveOrZero(message = "Time extension must not be negative")
    private long timeExtensionSeconds;

    @PositiveOrZero(message = "Extension window must not be negative")
    private long extensionWindowSeconds;
}
