package com.nosota.msettle.mapper;

import com.nosota.msettle.api.response.AuctionResponse;
import com.nosota.msettle.api.response.BidResponse;
import com.nosota.msettle.api.response.DutchAuctionResponse;
import com.nosota.msettle.model.Auction;
import com.nosota.msettle.model.Bid;
import com.nosota.msettle.model.DutchAuction;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for English and Dutch auctions.
 */
@Mapper
public interface AuctionMapper {

    AuctionMapper INSTANCE = Mappers.getMapper(AuctionMapper.class);

    AuctionResponse toResponse(Auction auction);

    BidResponse toResponse(Bid bid);

    List<BidResponse> toBidResponseList(List<Bid> bids);

    /**
     * The effective price moves with time, so it is computed by the service and passed in.
     */
    @Mapping(target = "currentPrice", source = "currentPrice")
    DutchAuctionResponse toResponse(DutchAuction auction, Long currentPrice);
}
