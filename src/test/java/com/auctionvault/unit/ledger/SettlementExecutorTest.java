package com.auctionvault.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.auctionvault.domain.model.TransferInstruction;
import com.auctionvault.domain.model.TransferReceipt;
import com.auctionvault.exception.AuctionException;
import com.auctionvault.exception.ErrorCode;
import com.auctionvault.exception.PaymentException;
import com.auctionvault.ledger.SettlementExecutor;
import com.auctionvault.payment.PaymentAdapter;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for SettlementExecutor covering ordered dispatch and reverse compensation.
 */
@ExtendWith(MockitoExtension.class)
class SettlementExecutorTest {

    private static final BigDecimal PRICE = new BigDecimal("100");

    @Mock
    private PaymentAdapter paymentAdapter;

    private SettlementExecutor executor;

    private final TransferInstruction pullFromBuyer = TransferInstruction.pull("USDC", "erin", PRICE);
    private final TransferInstruction assetToBuyer = TransferInstruction.release("ASSET-1", "erin", BigDecimal.ONE);
    private final TransferInstruction proceedsToOwner = TransferInstruction.release("USDC", "owner", PRICE);

    @BeforeEach
    void setUp() {
        executor = new SettlementExecutor(paymentAdapter);
    }

    private TransferReceipt receipt(String id, TransferInstruction instruction) {
        return new TransferReceipt(id, instruction);
    }

    @Nested
    @DisplayName("All transfers succeed")
    class Success {

        @Test
        @DisplayName("dispatches each instruction in order and returns the receipts")
        void dispatchesInOrder() {
            when(paymentAdapter.pull("USDC", "erin", PRICE)).thenReturn(receipt("r1", pullFromBuyer));
            when(paymentAdapter.release("ASSET-1", "erin", BigDecimal.ONE)).thenReturn(receipt("r2", assetToBuyer));
            when(paymentAdapter.release("USDC", "owner", PRICE)).thenReturn(receipt("r3", proceedsToOwner));

            List<TransferReceipt> receipts = executor.execute(List.of(pullFromBuyer, assetToBuyer, proceedsToOwner));

            assertThat(receipts).extracting(TransferReceipt::getReceiptId).containsExactly("r1", "r2", "r3");
            InOrder order = inOrder(paymentAdapter);
            order.verify(paymentAdapter).pull("USDC", "erin", PRICE);
            order.verify(paymentAdapter).release("ASSET-1", "erin", BigDecimal.ONE);
            order.verify(paymentAdapter).release("USDC", "owner", PRICE);
        }
    }

    @Nested
    @DisplayName("A transfer fails")
    class Failure {

        @Test
        @DisplayName("completed transfers are reversed newest first and TRANSFER_FAILED is thrown")
        void compensatesInReverse() {
            when(paymentAdapter.pull("USDC", "erin", PRICE)).thenReturn(receipt("r1", pullFromBuyer));
            when(paymentAdapter.release("ASSET-1", "erin", BigDecimal.ONE)).thenReturn(receipt("r2", assetToBuyer));
            when(paymentAdapter.release("USDC", "owner", PRICE)).thenThrow(new PaymentException("owner wallet frozen"));
            when(paymentAdapter.pull("ASSET-1", "erin", BigDecimal.ONE)).thenReturn(receipt("c1", assetToBuyer.compensation()));
            when(paymentAdapter.release("USDC", "erin", PRICE)).thenReturn(receipt("c2", pullFromBuyer.compensation()));

            assertThatThrownBy(() -> executor.execute(List.of(pullFromBuyer, assetToBuyer, proceedsToOwner)))
                    .isInstanceOf(AuctionException.class)
                    .hasCauseInstanceOf(PaymentException.class)
                    .satisfies(e -> {
                        AuctionException failure = (AuctionException) e;
                        assertThat(failure.getErrorCode()).isEqualTo(ErrorCode.TRANSFER_FAILED);
                        assertThat(failure.getDetails()).containsEntry("compensated", 2);
                    });

            InOrder order = inOrder(paymentAdapter);
            order.verify(paymentAdapter).release("USDC", "owner", PRICE);
            order.verify(paymentAdapter).pull("ASSET-1", "erin", BigDecimal.ONE);
            order.verify(paymentAdapter).release("USDC", "erin", PRICE);
        }

        @Test
        @DisplayName("a failing first transfer needs no compensation")
        void firstTransferFails() {
            when(paymentAdapter.pull("USDC", "erin", PRICE)).thenThrow(new PaymentException("insufficient allowance"));

            assertThatThrownBy(() -> executor.executeSingle(pullFromBuyer)).isInstanceOf(AuctionException.class);

            verify(paymentAdapter, never()).release("USDC", "erin", PRICE);
        }

        @Test
        @DisplayName("a failed compensation is reported as uncompensated")
        void compensationFailure() {
            when(paymentAdapter.pull("USDC", "erin", PRICE)).thenReturn(receipt("r1", pullFromBuyer));
            when(paymentAdapter.release("ASSET-1", "erin", BigDecimal.ONE)).thenThrow(new PaymentException("asset locked"));
            when(paymentAdapter.release("USDC", "erin", PRICE)).thenThrow(new PaymentException("network down"));

            assertThatThrownBy(() -> executor.execute(List.of(pullFromBuyer, assetToBuyer)))
                    .isInstanceOf(AuctionException.class)
                    .satisfies(e -> assertThat(((AuctionException) e).getDetails())
                            .containsEntry("compensated", 0)
                            .containsEntry("uncompensated", List.of(pullFromBuyer.toString())));
        }
    }
}
