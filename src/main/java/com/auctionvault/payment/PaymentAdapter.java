package com.auctionvault.payment;

import com.auctionvault.domain.model.TransferReceipt;
import java.math.BigDecimal;

/**
 * Boundary to whatever actually moves assets and funds. The engine never moves value
 * itself: it decides which transfers must happen and instructs the adapter.
 *
 * <p>Every method either completes the transfer and returns a receipt, or throws
 * {@link com.auctionvault.exception.PaymentException} having moved nothing. Any other
 * runtime exception is treated the same way by the engine.
 *
 * <p>The engine calls the adapter while holding the lock of the auction concerned, so
 * implementations must not call back into the engine.
 */
public interface PaymentAdapter {

    /**
     * Takes {@code amount} of {@code asset} from {@code from} into the engine's custody.
     * Used for auctioned assets at auction creation and for native currency attached
     * to a bid.
     */
    TransferReceipt custody(String asset, String from, BigDecimal amount);

    /**
     * Pays {@code amount} of {@code asset} out of the engine's custody to {@code to}.
     */
    TransferReceipt release(String asset, String to, BigDecimal amount);

    /**
     * Pulls {@code amount} of a token payment asset from {@code from} into custody.
     */
    TransferReceipt pull(String paymentAsset, String from, BigDecimal amount);
}
