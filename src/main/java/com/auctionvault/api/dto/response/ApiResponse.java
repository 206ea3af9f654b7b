package com.auctionvault.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope. {@code actorId} is the identity the engine acted for, taken from the
 * bearer token; it is omitted on unauthenticated routes such as token issuance.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final String actorId;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(String actorId, T data) {
        this.success = true;
        this.actorId = actorId;
        this.data = data;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(String actorId, T data) {
        return new ApiResponse<>(actorId, data);
    }
}
