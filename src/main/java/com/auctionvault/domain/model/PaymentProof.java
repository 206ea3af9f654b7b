package com.auctionvault.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Evidence of funds accompanying a bid.
 *
 * <p>For native-currency auctions {@code attachedValue} is the value sent with the
 * call and must equal the bid amount exactly. For token auctions it is ignored and
 * the funds are pulled from the bidder through the payment adapter.
 */
@Value
public class PaymentProof {

    BigDecimal attachedValue;

    /** Optional external reference (wallet transaction id, payment intent...). */
    String reference;
}
