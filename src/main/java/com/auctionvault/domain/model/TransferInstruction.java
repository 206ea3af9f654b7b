package com.auctionvault.domain.model;

import com.auctionvault.domain.enums.TransferType;
import java.math.BigDecimal;
import lombok.Value;

/**
 * A single movement the payment adapter must perform. {@code party} is the
 * counterparty: the source for CUSTODY/PULL and the destination for RELEASE.
 */
@Value
public class TransferInstruction {

    TransferType type;
    String asset;
    String party;
    BigDecimal amount;

    public static TransferInstruction custody(String asset, String from, BigDecimal amount) {
        return new TransferInstruction(TransferType.CUSTODY, asset, from, amount);
    }

    public static TransferInstruction release(String asset, String to, BigDecimal amount) {
        return new TransferInstruction(TransferType.RELEASE, asset, to, amount);
    }

    public static TransferInstruction pull(String asset, String from, BigDecimal amount) {
        return new TransferInstruction(TransferType.PULL, asset, from, amount);
    }

    /**
     * The movement that undoes this one: inbound transfers are returned, outbound
     * ones are pulled back from the party.
     */
    public TransferInstruction compensation() {
        return switch (type) {
            case CUSTODY, PULL -> release(asset, party, amount);
            case RELEASE -> pull(asset, party, amount);
        };
    }

    @Override
    public String toString() {
        return type + " " + amount + " " + asset + " <-> " + party;
    }
}
