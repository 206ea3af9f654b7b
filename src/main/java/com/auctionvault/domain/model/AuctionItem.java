package com.auctionvault.domain.model;

import com.auctionvault.domain.enums.AuctionStatus;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * One auction. Records are never removed from the registry; ending or cancelling
 * only deactivates them so that they stay queryable for audit.
 *
 * <p>Only {@code endTime} (anti-snipe extension), {@code active}, {@code canceled},
 * {@code closedAt} and {@code extensionCount} change after creation. All mutation
 * happens under the auction's lock in the engine; readers receive copies.
 */
@Data
@Builder(toBuilder = true)
public class AuctionItem {

    private long id;

    /** Reference of the auctioned asset held in custody while the auction runs. */
    private String assetId;

    /** Payment asset: the native currency sentinel or a token identifier. */
    private String paymentAsset;

    private String owner;

    private BigDecimal reservePrice;
    private BigDecimal buyNowPrice;
    private BigDecimal minimumBidIncrement;

    /** Added to endTime by each bid inside the extension window. */
    private Duration timeExtension;

    /** Distance before endTime inside which a bid extends the auction. */
    private Duration extensionWindow;

    /** Platform fee percentage captured when the auction was created. */
    private BigDecimal feePercentage;

    private Instant createdAt;
    private Instant endTime;
    private Instant closedAt;

    private int extensionCount;

    @Builder.Default
    private boolean active = true;

    private boolean canceled;

    public AuctionStatus getStatus() {
        if (canceled) {
            return AuctionStatus.CANCELED;
        }
        return active ? AuctionStatus.ACTIVE : AuctionStatus.ENDED;
    }

    public AuctionItem copy() {
        return toBuilder().build();
    }
}
