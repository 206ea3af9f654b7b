package com.auctionvault.payment;

import com.auctionvault.domain.model.TransferInstruction;
import com.auctionvault.domain.model.TransferReceipt;
import com.auctionvault.exception.PaymentException;
import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Paper settlement implementation of {@link PaymentAdapter}.
 *
 * <p>Inbound transfers (custody, pull) always succeed: the counterparty's external
 * wallet is assumed to hold the funds. The adapter keeps its own account of what the
 * engine holds per asset and refuses any release that would overdraw it, which makes
 * it an independent check on the engine's treasury arithmetic.
 *
 * <p>Every executed transfer gets a sequential {@code TX-n} receipt id and is logged at debug.
 */
@Service
public class LedgerPaymentAdapter implements PaymentAdapter {

    private static final Logger log = LoggerFactory.getLogger(LedgerPaymentAdapter.class);

    private final Map<String, BigDecimal> custodyBalances = new ConcurrentHashMap<>();
    private final AtomicLong receiptSequence = new AtomicLong();

    @Override
    public synchronized TransferReceipt custody(String asset, String from, BigDecimal amount) {
        requirePositive(amount);
        custodyBalances.merge(asset, amount, BigDecimal::add);
        return record(TransferInstruction.custody(asset, from, amount));
    }

    @Override
    public synchronized TransferReceipt release(String asset, String to, BigDecimal amount) {
        requirePositive(amount);
        BigDecimal held = custodyBalances.getOrDefault(asset, BigDecimal.ZERO);
        if (held.compareTo(amount) < 0) {
            log.error("Release of {} {} to {} refused: custody holds only {}", amount, asset, to, held);
            throw new PaymentException("Insufficient custody balance for " + asset + ": " + held + " < " + amount);
        }
        custodyBalances.put(asset, held.subtract(amount));
        return record(TransferInstruction.release(asset, to, amount));
    }

    @Override
    public synchronized TransferReceipt pull(String paymentAsset, String from, BigDecimal amount) {
        requirePositive(amount);
        custodyBalances.merge(paymentAsset, amount, BigDecimal::add);
        return record(TransferInstruction.pull(paymentAsset, from, amount));
    }

    private TransferReceipt record(TransferInstruction instruction) {
        TransferReceipt receipt = new TransferReceipt("TX-" + receiptSequence.incrementAndGet(), instruction);
        log.debug("Paper transfer {}: {}", receipt.getReceiptId(), instruction);
        return receipt;
    }

    private void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new PaymentException("Transfer amount must be positive: " + amount);
        }
    }
}
