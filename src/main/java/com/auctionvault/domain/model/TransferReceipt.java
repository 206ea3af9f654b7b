package com.auctionvault.domain.model;

import lombok.Value;

@Value
public class TransferReceipt {

    String receiptId;
    TransferInstruction instruction;
}
