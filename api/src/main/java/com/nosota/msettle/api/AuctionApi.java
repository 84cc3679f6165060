package com.nosota.msettle.api;

import com.nosota.msettle.api.request.AmountRequest;
import com.nosota.msettle.api.request.CreateAuctionRequest;
import com.nosota.msettle.api.request.CreateDutchAuctionRequest;
import com.nosota.msettle.api.request.PurchaseRequest;
import com.nosota.msettle.api.response.AuctionResponse;
import com.nosota.msettle.api.response.BidResponse;
import com.nosota.msettle.api.response.DutchAuctionResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Auction API: English (ascending-bid) and Dutch (descending-price) auctions.
 */
@RequestMapping("/api/v1")
public interface AuctionApi {

    // ==================== English Auctions ====================

    @PostMapping("/auctions")
    ResponseEntity<AuctionResponse> createAuction(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @RequestBody @Valid CreateAuctionRequest request) throws Exception;

    @GetMapping("/auctions/{auctionId}")
    ResponseEntity<AuctionResponse> getAuction(
            @PathVariable("auctionId") UUID auctionId);

    /**
     * Places a bid; the bid amount is taken into custody and the previous high bidder refunded.
     */
    @PostMapping("/auctions/{auctionId}/bids")
    ResponseEntity<AuctionResponse> placeBid(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("auctionId") UUID auctionId,
            @RequestBody @Valid AmountRequest request) throws Exception;

    @GetMapping("/auctions/{auctionId}/bids")
    ResponseEntity<List<BidResponse>> getBids(
            @PathVariable("auctionId") UUID auctionId);

    @PostMapping("/auctions/{auctionId}/end")
    ResponseEntity<AuctionResponse> endAuction(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("auctionId") UUID auctionId) throws Exception;

    @PostMapping("/auctions/{auctionId}/cancel")
    ResponseEntity<AuctionResponse> cancelAuction(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("auctionId") UUID auctionId) throws Exception;

    // ==================== Dutch Auctions ====================

    @PostMapping("/dutch-auctions")
    ResponseEntity<DutchAuctionResponse> createDutchAuction(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @RequestBody @Valid CreateDutchAuctionRequest request) throws Exception;

    /**
     * Gets a Dutch auction with its effective price at the time of the call.
     */
    @GetMapping("/dutch-auctions/{auctionId}")
    ResponseEntity<DutchAuctionResponse> getDutchAuction(
            @PathVariable("auctionId") UUID auctionId);

    @PostMapping("/dutch-auctions/{auctionId}/purchase")
    ResponseEntity<DutchAuctionResponse> purchaseDutchAuctionItem(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("auctionId") UUID auctionId,
            @RequestBody @Valid PurchaseRequest request) throws Exception;

    @PostMapping("/dutch-auctions/{auctionId}/end")
    ResponseEntity<DutchAuctionResponse> endDutchAuction(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable("auctionId") UUID auctionId) throws Exception;
}
