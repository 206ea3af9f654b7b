package com.auctionvault.core.engine;

import com.auctionvault.auth.AccessControlService;
import com.auctionvault.domain.enums.Role;
import com.auctionvault.domain.model.AuctionItem;
import com.auctionvault.domain.model.AuctionTerms;
import com.auctionvault.domain.model.Bid;
import com.auctionvault.domain.model.HighestBid;
import com.auctionvault.domain.model.PaymentProof;
import com.auctionvault.domain.model.RateLimitStatus;
import com.auctionvault.domain.model.SystemMetrics;
import com.auctionvault.domain.model.SystemStatus;
import com.auctionvault.domain.model.TransferInstruction;
import com.auctionvault.domain.model.TreasuryPosition;
import com.auctionvault.event.AlertLevel;
import com.auctionvault.event.EventPublisherHelper;
import com.auctionvault.event.SystemEventType;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import com.auctionvault.exception.UnauthorizedException;
import com.auctionvault.ledger.AuctionRegistry;
import com.auctionvault.ledger.BidLedger;
import com.auctionvault.ledger.BidLedger.BidPlan;
import com.auctionvault.ledger.EscrowLedger;
import com.auctionvault.ledger.FeePolicy;
import com.auctionvault.ledger.SettlementExecutor;
import com.auctionvault.ledger.TreasuryLedger;
import com.auctionvault.observability.MetricsAggregator;
import com.auctionvault.risk.ActorThrottleRegistry;
import com.auctionvault.risk.BidderBlacklist;
import com.auctionvault.risk.CooldownGuard;
import com.auctionvault.risk.RateLimiter;
import com.auctionvault.risk.RateLimiter.RateWindow;
import com.auctionvault.risk.SystemStateController;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single entry point for every auction operation.
 *
 * <p>Each mutating operation runs in three phases:
 * <ol>
 *   <li><b>Validate:</b> gates and domain checks, reading state only</li>
 *   <li><b>Settle:</b> all transfers through {@link SettlementExecutor}, which
 *       compensates completed transfers if a later one fails</li>
 *   <li><b>Commit:</b> registry, ledgers, throttle state and metrics are updated by
 *       methods that cannot fail, then events are published</li>
 * </ol>
 * A failure in the first two phases leaves no state change and publishes nothing.
 *
 * <p><b>Concurrency model:</b> one lock per actor throttle record and one per auction.
 * placeBid takes the bidder's lock first, then the auction's; no operation takes them in
 * the opposite order. Operations on different auctions proceed in parallel.
 *
 * <p>The caller identity and {@code now} are parameters of every operation; the engine
 * never reads a clock.
 */
@Service
public class AuctionEngine {

    private static final Logger log = LoggerFactory.getLogger(AuctionEngine.class);

    /** Quantity of an auctioned asset moved at creation and settlement. */
    private static final BigDecimal ASSET_UNIT = BigDecimal.ONE;

    private static final String TRIGGER_EXPLICIT = "EXPLICIT";
    private static final String TRIGGER_BUY_NOW = "BUY_NOW";

    private final EngineSettings engineSettings;
    private final AccessControlService accessControlService;
    private final SystemStateController systemStateController;
    private final ActorThrottleRegistry actorThrottleRegistry;
    private final RateLimiter rateLimiter;
    private final CooldownGuard cooldownGuard;
    private final BidderBlacklist bidderBlacklist;
    private final AuctionRegistry auctionRegistry;
    private final BidLedger bidLedger;
    private final EscrowLedger escrowLedger;
    private final TreasuryLedger treasuryLedger;
    private final FeePolicy feePolicy;
    private final SettlementExecutor settlementExecutor;
    private final MetricsAggregator metricsAggregator;
    private final EventPublisherHelper eventPublisherHelper;

    private final Object recoveryLock = new Object();

    public AuctionEngine(
            EngineSettings engineSettings,
            AccessControlService accessControlService,
            SystemStateController systemStateController,
            ActorThrottleRegistry actorThrottleRegistry,
            RateLimiter rateLimiter,
            CooldownGuard cooldownGuard,
            BidderBlacklist bidderBlacklist,
            AuctionRegistry auctionRegistry,
            BidLedger bidLedger,
            EscrowLedger escrowLedger,
            TreasuryLedger treasuryLedger,
            FeePolicy feePolicy,
            SettlementExecutor settlementExecutor,
            MetricsAggregator metricsAggregator,
            EventPublisherHelper eventPublisherHelper) {
        this.engineSettings = engineSettings;
        this.accessControlService = accessControlService;
        this.systemStateController = systemStateController;
        this.actorThrottleRegistry = actorThrottleRegistry;
        this.rateLimiter = rateLimiter;
        this.cooldownGuard = cooldownGuard;
        this.bidderBlacklist = bidderBlacklist;
        this.auctionRegistry = auctionRegistry;
        this.bidLedger = bidLedger;
        this.escrowLedger = escrowLedger;
        this.treasuryLedger = treasuryLedger;
        this.feePolicy = feePolicy;
        this.settlementExecutor = settlementExecutor;
        this.metricsAggregator = metricsAggregator;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ========================
    // AUCTION LIFECYCLE
    // ========================

    /**
     * Creates an auction and takes the asset into custody from the owner.
     *
     * @return the new auction's id
     */
    public long createAuction(String owner, AuctionTerms terms, Instant now) {
        requireActor(owner);
        ReentrantLock actorLock = actorThrottleRegistry.lockFor(owner);
        actorLock.lock();
        try {
            systemStateController.assertOperable();
            RateWindow window = rateLimiter.evaluate(owner, now);
            auctionRegistry.validateTerms(terms);

            settlementExecutor.executeSingle(TransferInstruction.custody(terms.getAssetId(), owner, ASSET_UNIT));

            AuctionItem auction =
                    auctionRegistry.register(owner, terms, feePolicy.getPlatformFeePercentage(), now);
            treasuryLedger.receive(terms.getAssetId(), ASSET_UNIT);
            rateLimiter.commit(owner, window);
            SystemMetrics metrics = metricsAggregator.recordAuctionCreated(now);

            eventPublisherHelper.publishAuctionCreated(this, auction);
            eventPublisherHelper.publishMetricsUpdated(this, metrics);
            return auction.getId();
        } finally {
            actorLock.unlock();
        }
    }

    /**
     * Places a bid. A bid reaching the buy-now price settles the auction in the same
     * operation; if any part of that settlement fails, the bid is rejected as well.
     *
     * @return the accepted bid
     */
    public Bid placeBid(long auctionId, String bidder, BigDecimal amount, PaymentProof paymentProof, Instant now) {
        requireActor(bidder);
        if (amount == null) {
            throw new AuctionException(ErrorCode.INVALID_AMOUNT, "Bid amount is required");
        }
        ReentrantLock actorLock = actorThrottleRegistry.lockFor(bidder);
        actorLock.lock();
        try {
            systemStateController.assertOperable();
            RateWindow window = rateLimiter.evaluate(bidder, now);
            cooldownGuard.check(bidder, now);

            ReentrantLock auctionLock = auctionRegistry.lockFor(auctionId);
            auctionLock.lock();
            try {
                AuctionItem auction = auctionRegistry.require(auctionId);
                BidPlan plan = bidLedger.validateBid(auction, bidder, amount, now);

                List<TransferInstruction> transfers = new ArrayList<>();
                transfers.add(fundingTransfer(auction, bidder, amount, paymentProof));
                Settlement settlement = null;
                if (plan.buyNow()) {
                    auctionRegistry.validateEnd(auction, now, false);
                    settlement = planSettlement(auction, HighestBid.of(bidder, amount));
                    transfers.addAll(settlement.transfers());
                }
                settlementExecutor.execute(transfers);

                Bid bid = bidLedger.commitBid(plan, now);
                treasuryLedger.receive(auction.getPaymentAsset(), amount);
                if (plan.extendsAuction()) {
                    auctionRegistry.extend(auctionId, plan.newEndTime());
                }
                rateLimiter.commit(bidder, window);
                cooldownGuard.arm(bidder, now);
                SystemMetrics bidMetrics = metricsAggregator.recordVolume(amount, now);
                SystemMetrics endMetrics = settlement != null ? commitSettlement(auction, settlement, now) : null;

                log.info(
                        "Bid #{} on auction #{} accepted: bidder={}, amount={}{}",
                        bid.getIndex(),
                        auctionId,
                        bidder,
                        amount,
                        plan.buyNow() ? " (buy-now)" : "");

                if (plan.extendsAuction()) {
                    eventPublisherHelper.publishAuctionExtended(this, auctionRegistry.require(auctionId).copy(), bidder, now);
                }
                eventPublisherHelper.publishBidPlaced(this, auctionId, bidder, amount, now);
                eventPublisherHelper.publishMetricsUpdated(this, bidMetrics);
                if (settlement != null) {
                    publishSettlement(auction, settlement, TRIGGER_BUY_NOW, endMetrics, now);
                }
                return bid;
            } finally {
                auctionLock.unlock();
            }
        } finally {
            actorLock.unlock();
        }
    }

    /**
     * Settles an auction whose deadline has passed. Anyone may call it.
     *
     * @return the settled auction
     */
    public AuctionItem endAuction(long auctionId, String caller, Instant now) {
        ReentrantLock auctionLock = auctionRegistry.lockFor(auctionId);
        auctionLock.lock();
        try {
            AuctionItem auction = auctionRegistry.require(auctionId);
            auctionRegistry.validateEnd(auction, now, true);
            HighestBid highest = bidLedger.getHighestBid(auctionId);
            if (!highest.isPresent()) {
                throw new AuctionException(ErrorCode.INVALID_AUCTION, "Auction #" + auctionId + " has no bids");
            }

            Settlement settlement = planSettlement(auction, highest);
            settlementExecutor.execute(settlement.transfers());

            SystemMetrics metrics = commitSettlement(auction, settlement, now);
            log.info("Auction #{} ended by '{}'", auctionId, caller);
            publishSettlement(auction, settlement, TRIGGER_EXPLICIT, metrics, now);
            return auctionRegistry.require(auctionId).copy();
        } finally {
            auctionLock.unlock();
        }
    }

    /**
     * Cancels a live auction. The asset goes back to the owner and the current highest
     * bid, if any, becomes withdrawable escrow of its bidder.
     */
    public AuctionItem cancelAuction(long auctionId, String caller, Instant now) {
        ReentrantLock auctionLock = auctionRegistry.lockFor(auctionId);
        auctionLock.lock();
        try {
            AuctionItem auction = auctionRegistry.require(auctionId);
            if (!auction.getOwner().equals(caller) && !accessControlService.hasRole(caller, Role.AUCTIONEER)) {
                log.warn("Cancel of auction #{} refused for '{}'", auctionId, caller);
                throw new UnauthorizedException(
                        "Only the owner or an AUCTIONEER may cancel auction #" + auctionId,
                        Map.of("auctionId", auctionId));
            }
            auctionRegistry.validateCancel(auction);

            settlementExecutor.executeSingle(
                    TransferInstruction.release(auction.getAssetId(), auction.getOwner(), ASSET_UNIT));

            auctionRegistry.markCanceled(auctionId, now);
            HighestBid moved = bidLedger.releaseHighestToEscrow(auctionId);
            treasuryLedger.payOut(auction.getAssetId(), ASSET_UNIT);
            SystemMetrics metrics = metricsAggregator.recordAuctionClosed(now);

            AuctionItem canceled = auctionRegistry.require(auctionId).copy();
            eventPublisherHelper.publishAuctionCanceled(this, canceled, caller, moved.getBidder(), now);
            eventPublisherHelper.publishMetricsUpdated(this, metrics);
            return canceled;
        } finally {
            auctionLock.unlock();
        }
    }

    /**
     * Pays out the caller's escrow for one auction. Allowed in every system state and
     * after the auction ended or was canceled.
     *
     * @return the amount paid
     */
    public BigDecimal withdrawFunds(long auctionId, String bidder, Instant now) {
        requireActor(bidder);
        ReentrantLock auctionLock = auctionRegistry.lockFor(auctionId);
        auctionLock.lock();
        try {
            AuctionItem auction = auctionRegistry.require(auctionId);
            if (escrowLedger.balanceOf(auctionId, bidder).signum() <= 0) {
                throw new AuctionException(
                        ErrorCode.INVALID_AMOUNT,
                        "No escrow balance for '" + bidder + "' on auction #" + auctionId,
                        Map.of("auctionId", auctionId, "bidder", bidder));
            }

            BigDecimal amount = escrowLedger.zero(auctionId, bidder);
            try {
                settlementExecutor.executeSingle(
                        TransferInstruction.release(auction.getPaymentAsset(), bidder, amount));
            } catch (AuctionException e) {
                escrowLedger.restore(auctionId, bidder, amount);
                log.error("Withdrawal of {} for '{}' on auction #{} failed, escrow restored", amount, bidder, auctionId);
                throw e;
            }

            treasuryLedger.payOut(auction.getPaymentAsset(), amount);
            bidLedger.markWithdrawn(auctionId, bidder);
            log.info("Escrow withdrawn: auction #{}, bidder={}, amount={}", auctionId, bidder, amount);
            eventPublisherHelper.publishBidWithdrawn(this, auctionId, bidder, amount, now);
            return amount;
        } finally {
            auctionLock.unlock();
        }
    }

    // ========================
    // ADMINISTRATION
    // ========================

    public void setEmergencyState(String caller, boolean enable, Instant now) {
        systemStateController.setEmergencyState(caller, enable, now);
    }

    public void setMaintenanceMode(String caller, boolean enable, Instant now) {
        systemStateController.setMaintenanceMode(caller, enable, now);
    }

    public void blacklistBidder(String caller, String bidder, String reason, Instant now) {
        bidderBlacklist.blacklist(caller, bidder, reason, now);
    }

    public void removeFromBlacklist(String caller, String bidder, Instant now) {
        bidderBlacklist.remove(caller, bidder, now);
    }

    public void setPlatformFee(String caller, BigDecimal percentage, Instant now) {
        feePolicy.setPlatformFee(caller, percentage, now);
    }

    public void grantRole(String caller, String actor, Role role, Instant now) {
        accessControlService.grantRole(caller, actor, role, now);
    }

    public void revokeRole(String caller, String actor, Role role, Instant now) {
        accessControlService.revokeRole(caller, actor, role, now);
    }

    public Set<Role> getRoles(String actor) {
        return accessControlService.rolesOf(actor);
    }

    /**
     * Moves free treasury balance of {@code asset} to the caller. Escrowed bids, live
     * highest bids and custodied auction assets are owed and cannot be recovered.
     */
    public void recoverToken(String caller, String asset, BigDecimal amount, Instant now) {
        accessControlService.requireRole(caller, Role.RECOVERY);
        if (asset == null || asset.isBlank()) {
            throw new AuctionException(ErrorCode.BAD_REQUEST, "Asset is required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new AuctionException(ErrorCode.INVALID_AMOUNT, "Recovery amount must be positive");
        }
        synchronized (recoveryLock) {
            treasuryLedger.requireRecoverable(asset, amount);
            settlementExecutor.executeSingle(TransferInstruction.release(asset, caller, amount));
            treasuryLedger.recover(asset, amount);
        }

        log.warn("Recovered {} {} to '{}'", amount, asset, caller);
        Map<String, Object> details = Map.of("asset", asset, "amount", amount);
        eventPublisherHelper.publishSystemEvent(
                this, SystemEventType.EMERGENCY_ACTION, caller, "Recovered " + amount + " " + asset, now, details);
        eventPublisherHelper.publishSecurityAlert(
                this, AlertLevel.WARNING, caller, "Token recovery of " + amount + " " + asset, now, details);
    }

    // ========================
    // QUERIES
    // ========================

    public AuctionItem getAuction(long auctionId) {
        return auctionRegistry.snapshot(auctionId);
    }

    public List<AuctionItem> listAuctions() {
        return auctionRegistry.findAll();
    }

    public int getBidCount(long auctionId) {
        auctionRegistry.require(auctionId);
        return bidLedger.getBidCount(auctionId);
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is not a valid bid position
     */
    public Bid getBid(long auctionId, int index) {
        auctionRegistry.require(auctionId);
        return bidLedger.getBid(auctionId, index);
    }

    public List<Bid> getBids(long auctionId) {
        auctionRegistry.require(auctionId);
        return bidLedger.getBids(auctionId);
    }

    public HighestBid getHighestBid(long auctionId) {
        auctionRegistry.require(auctionId);
        return bidLedger.getHighestBid(auctionId);
    }

    public BigDecimal getEscrowBalance(long auctionId, String bidder) {
        auctionRegistry.require(auctionId);
        return escrowLedger.balanceOf(auctionId, bidder);
    }

    public SystemMetrics getSystemMetrics() {
        return metricsAggregator.snapshot();
    }

    public RateLimitStatus checkRateLimit(String actor, Instant now) {
        ReentrantLock actorLock = actorThrottleRegistry.lockFor(actor);
        actorLock.lock();
        try {
            return new RateLimitStatus(rateLimiter.actionsRemaining(actor, now), cooldownGuard.cooldownEnds(actor));
        } finally {
            actorLock.unlock();
        }
    }

    public SystemStatus getSystemStatus() {
        return systemStateController.getStatus();
    }

    public List<TreasuryPosition> getTreasuryPositions() {
        return treasuryLedger.positions();
    }

    public Set<String> getBlacklistedBidders() {
        return bidderBlacklist.list();
    }

    public BigDecimal getPlatformFeePercentage() {
        return feePolicy.getPlatformFeePercentage();
    }

    // ========================
    // SETTLEMENT
    // ========================

    private TransferInstruction fundingTransfer(
            AuctionItem auction, String bidder, BigDecimal amount, PaymentProof paymentProof) {
        if (engineSettings.isNative(auction.getPaymentAsset())) {
            BigDecimal attached = paymentProof != null ? paymentProof.getAttachedValue() : null;
            if (attached == null || attached.compareTo(amount) != 0) {
                throw new AuctionException(
                        ErrorCode.INVALID_AMOUNT,
                        "Attached value " + attached + " does not match bid amount " + amount,
                        Map.of("amount", amount));
            }
            return TransferInstruction.custody(auction.getPaymentAsset(), bidder, amount);
        }
        return TransferInstruction.pull(auction.getPaymentAsset(), bidder, amount);
    }

    private Settlement planSettlement(AuctionItem auction, HighestBid winning) {
        BigDecimal fee = FeePolicy.feeOn(winning.getAmount(), auction.getFeePercentage());
        BigDecimal proceeds = winning.getAmount().subtract(fee);
        List<TransferInstruction> transfers = new ArrayList<>();
        transfers.add(TransferInstruction.release(auction.getAssetId(), winning.getBidder(), ASSET_UNIT));
        if (proceeds.signum() > 0) {
            transfers.add(TransferInstruction.release(auction.getPaymentAsset(), auction.getOwner(), proceeds));
        }
        return new Settlement(winning.getBidder(), winning.getAmount(), fee, transfers);
    }

    private SystemMetrics commitSettlement(AuctionItem auction, Settlement settlement, Instant now) {
        auctionRegistry.markEnded(auction.getId(), now);
        treasuryLedger.payOut(auction.getAssetId(), ASSET_UNIT);
        treasuryLedger.settle(auction.getPaymentAsset(), settlement.price(), settlement.fee());
        return metricsAggregator.recordAuctionClosed(now);
    }

    private void publishSettlement(
            AuctionItem auction, Settlement settlement, String trigger, SystemMetrics metrics, Instant now) {
        log.info(
                "Auction #{} settled ({}): winner={}, price={}, fee={}",
                auction.getId(),
                trigger,
                settlement.winner(),
                settlement.price(),
                settlement.fee());
        eventPublisherHelper.publishAuctionEnded(
                this,
                auctionRegistry.require(auction.getId()).copy(),
                settlement.winner(),
                settlement.price(),
                settlement.fee(),
                trigger,
                now);
        eventPublisherHelper.publishMetricsUpdated(this, metrics);
    }

    private static void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new UnauthorizedException("Caller identity is required");
        }
    }

    private record Settlement(String winner, BigDecimal price, BigDecimal fee, List<TransferInstruction> transfers) {}
}
