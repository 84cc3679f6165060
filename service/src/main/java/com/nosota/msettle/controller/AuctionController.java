package com.nosota.msettle.controller;

import com.nosota.msettle.api.AuctionApi;
import com.nosota.msettle.api.request.AmountRequest;
import com.nosota.msettle.api.request.CreateAuctionRequest;
import com.nosota.msettle.api.request.CreateDutchAuctionRequest;
import com.nosota.msettle.api.request.PurchaseRequest;
import com.nosota.msettle.api.response.AuctionResponse;
import com.nosota.msettle.api.response.BidResponse;
import com.nosota.msettle.api.response.DutchAuctionResponse;
import com.nosota.msettle.mapper.AuctionMapper;
import com.nosota.msettle.model.Auction;
import com.nosota.msettle.model.DutchAuction;
import com.nosota.msettle.service.AuctionService;
import com.nosota.msettle.service.DutchAuctionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for English and Dutch auctions.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class AuctionController implements AuctionApi {

    private final AuctionService auctionService;
    private final DutchAuctionService dutchAuctionService;

    // ==================== English Auctions ====================

    @Override
    public ResponseEntity<AuctionResponse> createAuction(String caller, CreateAuctionRequest request)
            throws Exception {
        Auction auction = auctionService.createAuction(caller, request.itemRef(), request.itemToken(),
                request.itemQuantity(), request.startingPrice(), request.durationSeconds(),
                request.minIncrement(), request.reservePrice());
        return ResponseEntity.status(HttpStatus.CREATED).body(AuctionMapper.INSTANCE.toResponse(auction));
    }

    @Override
    public ResponseEntity<AuctionResponse> getAuction(UUID auctionId) {
        return ResponseEntity.ok(AuctionMapper.INSTANCE.toResponse(auctionService.getAuction(auctionId)));
    }

    @Override
    public ResponseEntity<AuctionResponse> placeBid(String caller, UUID auctionId, AmountRequest request)
            throws Exception {
        Auction auction = auctionService.placeBid(auctionId, caller, request.amount());
        return ResponseEntity.status(HttpStatus.CREATED).body(AuctionMapper.INSTANCE.toResponse(auction));
    }

    @Override
    public ResponseEntity<List<BidResponse>> getBids(UUID auctionId) {
        return ResponseEntity.ok(AuctionMapper.INSTANCE.toBidResponseList(auctionService.getBids(auctionId)));
    }

    @Override
    public ResponseEntity<AuctionResponse> endAuction(String caller, UUID auctionId) throws Exception {
        return ResponseEntity.ok(AuctionMapper.INSTANCE.toResponse(auctionService.endAuction(auctionId, caller)));
    }

    @Override
    public ResponseEntity<AuctionResponse> cancelAuction(String caller, UUID auctionId) throws Exception {
        return ResponseEntity.ok(AuctionMapper.INSTANCE.toResponse(auctionService.cancelAuction(auctionId, caller)));
    }

    // ==================== Dutch Auctions ====================

    @Override
    public ResponseEntity<DutchAuctionResponse> createDutchAuction(String caller, CreateDutchAuctionRequest request)
            throws Exception {
        DutchAuction auction = dutchAuctionService.createDutchAuction(caller, request.itemRef(), request.itemToken(),
                request.itemQuantity(), request.startingPrice(), request.reservePrice(), request.decrementAmount(),
                request.decrementIntervalSeconds(), request.durationSeconds());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(auction));
    }

    @Override
    public ResponseEntity<DutchAuctionResponse> getDutchAuction(UUID auctionId) {
        return ResponseEntity.ok(toResponse(dutchAuctionService.getDutchAuction(auctionId)));
    }

    @Override
    public ResponseEntity<DutchAuctionResponse> purchaseDutchAuctionItem(String caller, UUID auctionId,
                                                                        PurchaseRequest request) throws Exception {
        DutchAuction auction = dutchAuctionService.purchaseDutchAuctionItem(auctionId, caller, request.maxPayment());
        return ResponseEntity.ok(toResponse(auction));
    }

    @Override
    public ResponseEntity<DutchAuctionResponse> endDutchAuction(String caller, UUID auctionId) throws Exception {
        return ResponseEntity.ok(toResponse(dutchAuctionService.endDutchAuction(auctionId, caller)));
    }

    private DutchAuctionResponse toResponse(DutchAuction auction) {
        return AuctionMapper.INSTANCE.toResponse(auction, dutchAuctionService.getCurrentPrice(auction));
    }
}
