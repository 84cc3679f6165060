package com.nosota.msettle.api;

import com.nosota.msettle.api.request.AmountRequest;
import com.nosota.msettle.api.request.CreateAuctionRequest;
import com.nosota.msettle.api.request.CreateDutchAuctionRequest;
import com.nosota.msettle.api.request.PurchaseRequest;
import com.nosota.msettle.api.response.AuctionResponse;
import com.nosota.msettle.api.response.BidResponse;
import com.nosota.msettle.api.response.DutchAuctionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of AuctionApi.
 *
 * <p>Not a Spring @Component; see {@link LedgerClient} for registration.
 */
@RequiredArgsConstructor
@Slf4j
public class AuctionClient implements AuctionApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<AuctionResponse> createAuction(String caller, CreateAuctionRequest request) {
        log.debug("Calling createAuction: seller={}, itemRef={}", caller, request.itemRef());

        return webClient.post()
                .uri("/api/v1/auctions")
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(AuctionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AuctionResponse> getAuction(UUID auctionId) {
        return webClient.get()
                .uri("/api/v1/auctions/{auctionId}", auctionId)
                .retrieve()
                .toEntity(AuctionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AuctionResponse> placeBid(String caller, UUID auctionId, AmountRequest request) {
        log.debug("Calling placeBid: auctionId={}, bidder={}, amount={}", auctionId, caller, request.amount());

        return webClient.post()
                .uri("/api/v1/auctions/{auctionId}/bids", auctionId)
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(AuctionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<BidResponse>> getBids(UUID auctionId) {
        return webClient.get()
                .uri("/api/v1/auctions/{auctionId}/bids", auctionId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<BidResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<AuctionResponse> endAuction(String caller, UUID auctionId) {
        return webClient.post()
                .uri("/api/v1/auctions/{auctionId}/end", auctionId)
                .header(ApiHeaders.CALLER_ID, caller)
                .retrieve()
                .toEntity(AuctionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<AuctionResponse> cancelAuction(String caller, UUID auctionId) {
        return webClient.post()
                .uri("/api/v1/auctions/{auctionId}/cancel", auctionId)
                .header(ApiHeaders.CALLER_ID, caller)
                .retrieve()
                .toEntity(AuctionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DutchAuctionResponse> createDutchAuction(String caller, CreateDutchAuctionRequest request) {
        log.debug("Calling createDutchAuction: seller={}, itemRef={}", caller, request.itemRef());

        return webClient.post()
                .uri("/api/v1/dutch-auctions")
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(DutchAuctionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DutchAuctionResponse> getDutchAuction(UUID auctionId) {
        return webClient.get()
                .uri("/api/v1/dutch-auctions/{auctionId}", auctionId)
                .retrieve()
                .toEntity(DutchAuctionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DutchAuctionResponse> purchaseDutchAuctionItem(String caller, UUID auctionId,
                                                                        PurchaseRequest request) {
        log.debug("Calling purchaseDutchAuctionItem: auctionId={}, buyer={}, maxPayment={}",
                auctionId, caller, request.maxPayment());

        return webClient.post()
                .uri("/api/v1/dutch-auctions/{auctionId}/purchase", auctionId)
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(DutchAuctionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DutchAuctionResponse> endDutchAuction(String caller, UUID auctionId) {
        return webClient.post()
                .uri("/api/v1/dutch-auctions/{auctionId}/end", auctionId)
                .header(ApiHeaders.CALLER_ID, caller)
                .retrieve()
                .toEntity(DutchAuctionResponse.class)
                .block();
    }
}
