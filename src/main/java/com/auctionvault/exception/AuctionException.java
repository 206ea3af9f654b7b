package com.auctionvault.exception;

import java.util.Map;

/**
 * Raised when an engine operation fails a precondition. The operation has applied
 * no state change and published no event when this is thrown.
 */
public class AuctionException extends BaseException {

    public AuctionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public AuctionException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public AuctionException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
