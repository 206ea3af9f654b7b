package com.auctionvault.mapper;

import com.auctionvault.api.dto.response.AuctionResponse;
import com.auctionvault.api.dto.response.BidResponse;
import com.auctionvault.api.dto.response.SystemMetricsResponse;
import com.auctionvault.domain.model.AuctionItem;
import com.auctionvault.domain.model.Bid;
import com.auctionvault.domain.model.HighestBid;
import com.auctionvault.domain.model.SystemMetrics;
import java.time.Duration;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper from engine domain objects to REST response DTOs.
 *
 * <p>Durations are exposed in whole seconds, the auction status as its enum name.
 */
@Mapper(componentModel = "spring")
public interface AuctionMapper {

    @Mapping(source = "auction.timeExtension", target = "timeExtensionSeconds", qualifiedByName = "toSeconds")
    @Mapping(source = "auction.extensionWindow", target = "extensionWindowSeconds", qualifiedByName = "toSeconds")
    @Mapping(source = "leader.bidder", target = "highestBidder")
    @Mapping(source = "leader.amount", target = "highestBid")
    @Mapping(source = "bidCount", target = "bidCount")
    AuctionResponse toResponse(AuctionItem auction, HighestBid leader, int bidCount);

    BidResponse toResponse(Bid bid);

    List<BidResponse> toBidResponses(List<Bid> bids);

    SystemMetricsResponse toResponse(SystemMetrics metrics);

    @Named("toSeconds")
    default long toSeconds(Duration duration) {
        return duration != null ? duration.toSeconds() : 0L;
    }
}
