package com.auctionvault.ledger;

import com.auctionvault.domain.model.TransferInstruction;
import com.auctionvault.domain.model.TransferReceipt;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import com.auctionvault.exception.PaymentException;
import com.auctionvault.payment.PaymentAdapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the transfers of one engine operation as a unit.
 *
 * <p>Instructions execute in order, stopping at the first failure. Transfers that had
 * already completed are then compensated in reverse order and the operation fails with
 * TRANSFER_FAILED, so the engine never commits state for a half-settled operation.
 * A compensation that itself fails is logged with the instruction and left for manual
 * reconciliation against the payment provider's records.
 */
@Component
public class SettlementExecutor {

    private static final Logger log = LoggerFactory.getLogger(SettlementExecutor.class);

    private final PaymentAdapter paymentAdapter;

    public SettlementExecutor(PaymentAdapter paymentAdapter) {
        this.paymentAdapter = paymentAdapter;
    }

    /**
     * @return one receipt per instruction, in order
     * @throws AuctionException TRANSFER_FAILED if any instruction fails
     */
    public List<TransferReceipt> execute(List<TransferInstruction> instructions) {
        List<TransferReceipt> receipts = new ArrayList<>(instructions.size());
        for (int i = 0; i < instructions.size(); i++) {
            TransferInstruction instruction = instructions.get(i);
            try {
                receipts.add(dispatch(instruction));
            } catch (PaymentException e) {
                log.error("Transfer {}/{} failed: {} ({})", i + 1, instructions.size(), instruction, e.getMessage());
                List<TransferInstruction> uncompensated = compensate(receipts);
                AuctionException failure = new AuctionException(
                        ErrorCode.TRANSFER_FAILED,
                        "Transfer failed: " + instruction,
                        Map.of(
                                "failedInstruction", instruction.toString(),
                                "compensated", receipts.size() - uncompensated.size(),
                                "uncompensated", uncompensated.stream().map(TransferInstruction::toString).toList()));
                failure.initCause(e);
                throw failure;
            }
        }
        return receipts;
    }

    public TransferReceipt executeSingle(TransferInstruction instruction) {
        return execute(List.of(instruction)).get(0);
    }

    private TransferReceipt dispatch(TransferInstruction instruction) {
        return switch (instruction.getType()) {
            case CUSTODY -> paymentAdapter.custody(instruction.getAsset(), instruction.getParty(), instruction.getAmount());
            case RELEASE -> paymentAdapter.release(instruction.getAsset(), instruction.getParty(), instruction.getAmount());
            case PULL -> paymentAdapter.pull(instruction.getAsset(), instruction.getParty(), instruction.getAmount());
        };
    }

    /**
     * Reverses completed transfers newest first and returns those that could not be
     * reversed.
     */
    private List<TransferInstruction> compensate(List<TransferReceipt> completed) {
        List<TransferInstruction> uncompensated = new ArrayList<>();
        for (int i = completed.size() - 1; i >= 0; i--) {
            TransferInstruction original = completed.get(i).getInstruction();
            TransferInstruction reversal = original.compensation();
            try {
                dispatch(reversal);
                log.info("Compensated {} with {}", original, reversal);
            } catch (PaymentException e) {
                log.error("Compensation {} for {} failed, manual reconciliation required", reversal, original, e);
                uncompensated.add(original);
            }
        }
        return uncompensated;
    }
}
