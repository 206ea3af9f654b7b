package com.auctionvault.exception;

/**
 * Thrown by a {@link com.auctionvault.payment.PaymentAdapter} when a transfer cannot be
 * executed. The engine converts it into {@link ErrorCode#TRANSFER_FAILED}.
 */
public class PaymentException extends BaseException {

    public PaymentException(String message) {
        super(ErrorCode.TRANSFER_FAILED, message);
    }

    public PaymentException(String message, Throwable cause) {
        super(ErrorCode.TRANSFER_FAILED, message, cause);
    }
}
