package com.auctionvault.ledger;

import com.auctionvault.domain.model.AuctionItem;
import com.auctionvault.domain.model.Bid;
import com.auctionvault.domain.model.HighestBid;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import com.auctionvault.risk.BidderBlacklist;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Bid history and highest-bid state per auction, plus the escrow credits that
 * accepting a bid implies.
 *
 * <p>{@link #validateBid} is pure and returns a {@link BidPlan} with every derived value
 * the commit needs. {@link #commitBid} applies a plan and cannot fail. Both run under
 * the auction lock; the read methods may be called without it.
 */
@Component
public class BidLedger {

    private final Map<Long, AuctionBook> books = new ConcurrentHashMap<>();
    private final BidderBlacklist bidderBlacklist;
    private final EscrowLedger escrowLedger;

    public BidLedger(BidderBlacklist bidderBlacklist, EscrowLedger escrowLedger) {
        this.bidderBlacklist = bidderBlacklist;
        this.escrowLedger = escrowLedger;
    }

    /**
     * Checks, in order: auction active, bidder not blacklisted, deadline not passed,
     * amount above highest bid plus increment. The reserve price only bounds the
     * buy-now price at creation; the first bid is measured against zero.
     */
    public BidPlan validateBid(AuctionItem auction, String bidder, BigDecimal amount, Instant now) {
        long auctionId = auction.getId();
        if (!auction.isActive()) {
            throw new AuctionException(ErrorCode.AUCTION_NOT_ACTIVE, "Auction #" + auctionId + " is not active");
        }
        if (bidderBlacklist.isBlacklisted(bidder)) {
            throw new AuctionException(
                    ErrorCode.BLACKLISTED_BIDDER, "Bidder '" + bidder + "' is blacklisted", Map.of("bidder", bidder));
        }
        if (!now.isBefore(auction.getEndTime())) {
            throw new AuctionException(
                    ErrorCode.AUCTION_ENDED,
                    "Auction #" + auctionId + " ended at " + auction.getEndTime(),
                    Map.of("endTime", auction.getEndTime().toString()));
        }

        HighestBid previous = getHighestBid(auctionId);
        BigDecimal threshold = previous.getAmount().add(auction.getMinimumBidIncrement());
        if (amount.compareTo(threshold) <= 0) {
            throw new AuctionException(
                    ErrorCode.BID_TOO_LOW,
                    "Bid " + amount + " must exceed " + threshold,
                    Map.of("highestBid", previous.getAmount(), "minimumBidIncrement", auction.getMinimumBidIncrement()));
        }

        boolean extendsAuction = !now.isBefore(auction.getEndTime().minus(auction.getExtensionWindow()));
        Instant newEndTime = extendsAuction ? auction.getEndTime().plus(auction.getTimeExtension()) : auction.getEndTime();
        boolean buyNow = amount.compareTo(auction.getBuyNowPrice()) >= 0;
        return new BidPlan(auctionId, bidder, amount, previous, extendsAuction, newEndTime, buyNow);
    }

    /**
     * Credits the displaced leader's escrow, records the new leader and appends the bid.
     */
    public Bid commitBid(BidPlan plan, Instant now) {
        if (plan.previous().isPresent()) {
            escrowLedger.credit(plan.auctionId(), plan.previous().getBidder(), plan.previous().getAmount());
        }
        return bookOf(plan.auctionId()).append(plan.bidder(), plan.amount(), now);
    }

    /**
     * Moves the current highest bid of a canceled auction into its bidder's escrow.
     *
     * @return the bid that was moved, or {@link HighestBid#none()}
     */
    public HighestBid releaseHighestToEscrow(long auctionId) {
        AuctionBook book = books.get(auctionId);
        if (book == null) {
            return HighestBid.none();
        }
        HighestBid highest = book.clearHighest();
        if (highest.isPresent()) {
            escrowLedger.credit(auctionId, highest.getBidder(), highest.getAmount());
        }
        return highest;
    }

    /** Flags the bidder's bids that no longer lead the auction as withdrawn. */
    public void markWithdrawn(long auctionId, String bidder) {
        AuctionBook book = books.get(auctionId);
        if (book != null) {
            book.markWithdrawn(bidder);
        }
    }

    // ========================
    // QUERIES
    // ========================

    public HighestBid getHighestBid(long auctionId) {
        AuctionBook book = books.get(auctionId);
        return book == null ? HighestBid.none() : book.highest();
    }

    public int getBidCount(long auctionId) {
        AuctionBook book = books.get(auctionId);
        return book == null ? 0 : book.size();
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is not in [0, bidCount)
     */
    public Bid getBid(long auctionId, int index) {
        AuctionBook book = books.get(auctionId);
        if (book == null) {
            throw new IndexOutOfBoundsException("Bid index " + index + " out of range for auction #" + auctionId);
        }
        return book.get(index);
    }

    public List<Bid> getBids(long auctionId) {
        AuctionBook book = books.get(auctionId);
        return book == null ? List.of() : book.all();
    }

    private AuctionBook bookOf(long auctionId) {
        return books.computeIfAbsent(auctionId, AuctionBook::new);
    }

    /**
     * Everything a validated bid needs to commit.
     *
     * @param previous     leader being displaced, or {@link HighestBid#none()}
     * @param extendsAuction whether the bid falls inside the extension window
     * @param newEndTime   end time after this bid
     * @param buyNow       whether the amount reaches the buy-now price
     */
    public record BidPlan(
            long auctionId,
            String bidder,
            BigDecimal amount,
            HighestBid previous,
            boolean extendsAuction,
            Instant newEndTime,
            boolean buyNow) {}

    private static final class AuctionBook {

        private final long auctionId;
        private final List<Bid> bids = new ArrayList<>();
        private HighestBid highest = HighestBid.none();
        private int highestIndex = -1;

        private AuctionBook(long auctionId) {
            this.auctionId = auctionId;
        }

        synchronized Bid append(String bidder, BigDecimal amount, Instant now) {
            Bid bid = Bid.builder()
                    .auctionId(auctionId)
                    .index(bids.size())
                    .bidder(bidder)
                    .amount(amount)
                    .timestamp(now)
                    .build();
            bids.add(bid);
            highest = HighestBid.of(bidder, amount);
            highestIndex = bid.getIndex();
            return bid.copy();
        }

        synchronized HighestBid clearHighest() {
            HighestBid current = highest;
            highest = HighestBid.none();
            highestIndex = -1;
            return current;
        }

        synchronized void markWithdrawn(String bidder) {
            for (Bid bid : bids) {
                if (bid.getIndex() != highestIndex && bid.getBidder().equals(bidder)) {
                    bid.setWithdrawn(true);
                }
            }
        }

        synchronized HighestBid highest() {
            return highest;
        }

        synchronized int size() {
            return bids.size();
        }

        synchronized Bid get(int index) {
            if (index < 0 || index >= bids.size()) {
                throw new IndexOutOfBoundsException(
                        "Bid index " + index + " out of range for auction #" + auctionId + " (" + bids.size() + " bids)");
            }
            return bids.get(index).copy();
        }

        synchronized List<Bid> all() {
            return bids.stream().map(Bid::copy).toList();
        }
    }
}
