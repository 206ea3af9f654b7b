package com.auctionvault.ledger;

import com.auctionvault.domain.model.TreasuryPosition;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-asset account of the funds the engine holds and how much of them is owed.
 *
 * <p>Movements and their effect on (held, owed):
 * <ul>
 *   <li>{@link #receive}: bid funds or a custodied asset come in, +x / +x</li>
 *   <li>{@link #payOut}: escrow withdrawal, asset handed over, -x / -x</li>
 *   <li>{@link #settle}: auction proceeds go to the owner, -(price - fee) / -price,
 *       leaving the fee as free balance</li>
 *   <li>{@link #recover}: free balance taken by the recovery role, -x / 0</li>
 * </ul>
 * The engine records a movement only after the matching transfer succeeded. Owed
 * never exceeds held, so recovery can never touch bidder funds.
 */
@Component
public class TreasuryLedger {

    private static final Logger log = LoggerFactory.getLogger(TreasuryLedger.class);

    private final Map<String, TreasuryPosition> positions = new TreeMap<>();

    public synchronized void receive(String asset, BigDecimal amount) {
        TreasuryPosition position = positionOf(asset);
        positions.put(asset, new TreasuryPosition(asset, position.getHeld().add(amount), position.getOwed().add(amount)));
    }

    public synchronized void payOut(String asset, BigDecimal amount) {
        TreasuryPosition position = positionOf(asset);
        positions.put(
                asset,
                new TreasuryPosition(asset, position.getHeld().subtract(amount), position.getOwed().subtract(amount)));
    }

    public synchronized void settle(String asset, BigDecimal price, BigDecimal fee) {
        TreasuryPosition position = positionOf(asset);
        positions.put(
                asset,
                new TreasuryPosition(
                        asset, position.getHeld().subtract(price.subtract(fee)), position.getOwed().subtract(price)));
    }

    /**
     * @throws AuctionException INVALID_AMOUNT if {@code amount} exceeds the free balance
     */
    public synchronized void requireRecoverable(String asset, BigDecimal amount) {
        BigDecimal recoverable = positionOf(asset).getRecoverable();
        if (amount.compareTo(recoverable) > 0) {
            log.warn("Recovery of {} {} refused: only {} is free", amount, asset, recoverable);
            throw new AuctionException(
                    ErrorCode.INVALID_AMOUNT,
                    "Requested " + amount + " " + asset + " exceeds recoverable balance " + recoverable,
                    Map.of("asset", asset, "recoverable", recoverable));
        }
    }

    public synchronized void recover(String asset, BigDecimal amount) {
        TreasuryPosition position = positionOf(asset);
        positions.put(asset, new TreasuryPosition(asset, position.getHeld().subtract(amount), position.getOwed()));
    }

    public synchronized List<TreasuryPosition> positions() {
        return List.copyOf(positions.values());
    }

    private TreasuryPosition positionOf(String asset) {
        return positions.getOrDefault(asset, TreasuryPosition.empty(asset));
    }
}
