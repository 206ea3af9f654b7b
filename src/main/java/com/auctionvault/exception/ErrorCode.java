package com.auctionvault.exception;

import lombok.Getter;

/**
 * Flat error kinds raised by the engine and the HTTP layer.
 *
 * <p>None of the engine kinds are retried internally. Kinds marked retryable clear on
 * their own (the rate window elapses, the cooldown passes, an operator lifts the pause,
 * the payment provider recovers), so a caller may resend the identical request later.
 * The rest need a different request.
 */
@Getter
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    UNAUTHENTICATED("UNAUTHENTICATED", 401),
    UNAUTHORIZED("UNAUTHORIZED", 403),
    NOT_FOUND("NOT_FOUND", 404),

    // ---- Engine ----
    INVALID_FEE_PERCENTAGE("INVALID_FEE_PERCENTAGE", 422),
    INVALID_AUCTION("INVALID_AUCTION", 422),
    AUCTION_NOT_ACTIVE("AUCTION_NOT_ACTIVE", 409),
    BID_TOO_LOW("BID_TOO_LOW", 422),
    AUCTION_ENDED("AUCTION_ENDED", 409),
    AUCTION_NOT_ENDED("AUCTION_NOT_ENDED", 409),
    BLACKLISTED_BIDDER("BLACKLISTED_BIDDER", 403),
    INVALID_AMOUNT("INVALID_AMOUNT", 422),
    RATE_LIMIT_EXCEEDED("RATE_LIMIT_EXCEEDED", 429, true),
    COOLDOWN_PERIOD("COOLDOWN_PERIOD", 429, true),
    INVALID_SYSTEM_STATE("INVALID_SYSTEM_STATE", 503, true),
    EMERGENCY_PAUSED("EMERGENCY_PAUSED", 503, true),
    TRANSFER_FAILED("TRANSFER_FAILED", 502, true),

    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;

    ErrorCode(String code, int httpStatus) {
        this(code, httpStatus, false);
    }

    ErrorCode(String code, int httpStatus, boolean retryable) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }
}
