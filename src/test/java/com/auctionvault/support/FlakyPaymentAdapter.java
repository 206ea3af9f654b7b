package com.auctionvault.support;

import com.auctionvault.domain.model.TransferReceipt;
import com.auctionvault.exception.PaymentException;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

/**
 * Paper adapter that can be told to refuse transfers involving given parties.
 */
public class FlakyPaymentAdapter extends RecordingPaymentAdapter {

    private final Set<String> refusedReleaseTo = new HashSet<>();
    private final Set<String> refusedInboundFrom = new HashSet<>();

    public void refuseReleasesTo(String party) {
        refusedReleaseTo.add(party);
    }

    public void refuseInboundFrom(String party) {
        refusedInboundFrom.add(party);
    }

    public void heal() {
        refusedReleaseTo.clear();
        refusedInboundFrom.clear();
    }

    @Override
    public synchronized TransferReceipt custody(String asset, String from, BigDecimal amount) {
        if (refusedInboundFrom.contains(from)) {
            throw new PaymentException("custody from " + from + " refused");
        }
        return super.custody(asset, from, amount);
    }

    @Override
    public synchronized TransferReceipt pull(String paymentAsset, String from, BigDecimal amount) {
        if (refusedInboundFrom.contains(from)) {
            throw new PaymentException("pull from " + from + " refused");
        }
        return super.pull(paymentAsset, from, amount);
    }

    @Override
    public synchronized TransferReceipt release(String asset, String to, BigDecimal amount) {
        if (refusedReleaseTo.contains(to)) {
            throw new PaymentException("release to " + to + " refused");
        }
        return super.release(asset, to, amount);
    }
}
