package com.auctionvault.ledger;

import com.auctionvault.domain.model.AuctionItem;
import com.auctionvault.domain.model.AuctionTerms;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns every {@link AuctionItem} and the per-auction lock serialising its writers.
 *
 * <p>Validation methods are pure and throw {@link AuctionException}; mark/extend
 * methods are the commit half and cannot fail. Callers hold {@link #lockFor(long)}
 * around both. Readers get copies.
 */
@Component
public class AuctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(AuctionRegistry.class);

    private final Map<Long, AuctionItem> auctions = new ConcurrentHashMap<>();
    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();

    // ========================
    // CREATION
    // ========================

    /**
     * @throws AuctionException INVALID_AMOUNT for inconsistent prices or durations
     */
    public void validateTerms(AuctionTerms terms) {
        if (terms.getAssetId() == null || terms.getAssetId().isBlank()) {
            throw invalidTerms("Asset id is required");
        }
        if (terms.getPaymentAsset() == null || terms.getPaymentAsset().isBlank()) {
            throw invalidTerms("Payment asset is required");
        }
        if (isMissingOrNegative(terms.getReservePrice())) {
            throw invalidTerms("Reserve price must be non-negative");
        }
        if (terms.getBuyNowPrice() == null || terms.getBuyNowPrice().compareTo(terms.getReservePrice()) <= 0) {
            throw invalidTerms("Buy-now price must exceed the reserve price");
        }
        if (isMissingOrNegative(terms.getMinimumBidIncrement())) {
            throw invalidTerms("Minimum bid increment must be non-negative");
        }
        if (terms.getDuration() == null || terms.getDuration().isNegative() || terms.getDuration().isZero()) {
            throw invalidTerms("Duration must be positive");
        }
        if (isMissingOrNegative(terms.getTimeExtension()) || isMissingOrNegative(terms.getExtensionWindow())) {
            throw invalidTerms("Time extension and extension window must be non-negative");
        }
    }

    /**
     * Allocates the next id and stores the auction. Ids start at 1 and are never reused.
     */
    public AuctionItem register(String owner, AuctionTerms terms, BigDecimal feePercentage, Instant now) {
        long id = idSequence.incrementAndGet();
        AuctionItem auction = AuctionItem.builder()
                .id(id)
                .assetId(terms.getAssetId())
                .paymentAsset(terms.getPaymentAsset())
                .owner(owner)
                .reservePrice(terms.getReservePrice())
                .buyNowPrice(terms.getBuyNowPrice())
                .minimumBidIncrement(terms.getMinimumBidIncrement())
                .timeExtension(terms.getTimeExtension())
                .extensionWindow(terms.getExtensionWindow())
                .feePercentage(feePercentage)
                .createdAt(now)
                .endTime(now.plus(terms.getDuration()))
                .build();
        auctions.put(id, auction);
        log.info(
                "Auction #{} registered: owner={}, asset={}, reserve={}, buyNow={}, endTime={}",
                id,
                owner,
                terms.getAssetId(),
                terms.getReservePrice(),
                terms.getBuyNowPrice(),
                auction.getEndTime());
        return auction.copy();
    }

    // ========================
    // LOOKUP
    // ========================

    /**
     * Lock of an existing auction. Unknown ids fail before a lock is created for them.
     *
     * @throws AuctionException INVALID_AUCTION if no auction has this id
     */
    public ReentrantLock lockFor(long auctionId) {
        if (!auctions.containsKey(auctionId)) {
            throw unknown(auctionId);
        }
        return locks.computeIfAbsent(auctionId, id -> new ReentrantLock());
    }

    /**
     * Live record for writers holding the auction lock.
     *
     * @throws AuctionException INVALID_AUCTION if no auction has this id
     */
    public AuctionItem require(long auctionId) {
        AuctionItem auction = auctions.get(auctionId);
        if (auction == null) {
            throw unknown(auctionId);
        }
        return auction;
    }

    /** Copy of the auction, taken under its lock. */
    public AuctionItem snapshot(long auctionId) {
        ReentrantLock lock = lockFor(auctionId);
        lock.lock();
        try {
            return require(auctionId).copy();
        } finally {
            lock.unlock();
        }
    }

    public List<AuctionItem> findAll() {
        return auctions.keySet().stream()
                .sorted()
                .map(this::snapshot)
                .toList();
    }

    // ========================
    // VALIDATION
    // ========================

    /**
     * @throws AuctionException INVALID_AUCTION if already canceled, AUCTION_NOT_ACTIVE if ended
     */
    public void validateCancel(AuctionItem auction) {
        if (auction.isCanceled()) {
            throw new AuctionException(
                    ErrorCode.INVALID_AUCTION, "Auction #" + auction.getId() + " is already canceled");
        }
        if (!auction.isActive()) {
            throw new AuctionException(ErrorCode.AUCTION_NOT_ACTIVE, "Auction #" + auction.getId() + " has ended");
        }
    }

    /**
     * Preconditions shared by the explicit end and the buy-now end. The deadline is only
     * enforced for the explicit end; the bid count is checked by the caller.
     */
    public void validateEnd(AuctionItem auction, Instant now, boolean explicit) {
        if (auction.isCanceled()) {
            throw new AuctionException(ErrorCode.INVALID_AUCTION, "Auction #" + auction.getId() + " was canceled");
        }
        if (!auction.isActive()) {
            throw new AuctionException(
                    ErrorCode.AUCTION_NOT_ACTIVE, "Auction #" + auction.getId() + " has already ended");
        }
        if (explicit && now.isBefore(auction.getEndTime())) {
            throw new AuctionException(
                    ErrorCode.AUCTION_NOT_ENDED,
                    "Auction #" + auction.getId() + " runs until " + auction.getEndTime(),
                    Map.of("endTime", auction.getEndTime().toString()));
        }
    }

    // ========================
    // COMMIT
    // ========================

    public void markCanceled(long auctionId, Instant now) {
        AuctionItem auction = require(auctionId);
        auction.setActive(false);
        auction.setCanceled(true);
        auction.setClosedAt(now);
        log.info("Auction #{} canceled", auctionId);
    }

    public void markEnded(long auctionId, Instant now) {
        AuctionItem auction = require(auctionId);
        auction.setActive(false);
        auction.setClosedAt(now);
        log.info("Auction #{} ended", auctionId);
    }

    public void extend(long auctionId, Instant newEndTime) {
        AuctionItem auction = require(auctionId);
        auction.setEndTime(newEndTime);
        auction.setExtensionCount(auction.getExtensionCount() + 1);
        log.info("Auction #{} extended to {} (extension {})", auctionId, newEndTime, auction.getExtensionCount());
    }

    private static boolean isMissingOrNegative(BigDecimal value) {
        return value == null || value.signum() < 0;
    }

    private static boolean isMissingOrNegative(Duration value) {
        return value == null || value.isNegative();
    }

    private static AuctionException unknown(long auctionId) {
        return new AuctionException(ErrorCode.INVALID_AUCTION, "Auction #" + auctionId + " does not exist");
    }

    private static AuctionException invalidTerms(String message) {
        return new AuctionException(ErrorCode.INVALID_AMOUNT, message);
    }
}
