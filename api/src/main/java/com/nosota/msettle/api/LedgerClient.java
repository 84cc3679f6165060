package com.nosota.msettle.api;

import com.nosota.msettle.api.dto.LedgerEntryDTO;
import com.nosota.msettle.api.request.DepositRequest;
import com.nosota.msettle.api.request.TransferRequest;
import com.nosota.msettle.api.request.WithdrawalRequest;
import com.nosota.msettle.api.response.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of LedgerApi for consuming the mSettle service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * register it as a bean themselves:
 * <pre>
 * {@code
 * @Configuration
 * public class MSettleClientConfig {
 *     @Bean
 *     public WebClient msettleWebClient(WebClient.Builder builder,
 *                                       @Value("${services.msettle.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public LedgerClient ledgerClient(WebClient msettleWebClient) {
 *         return new LedgerClient(msettleWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class LedgerClient implements LedgerApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<DepositResponse> deposit(String caller, DepositRequest request) {
        log.debug("Calling deposit: caller={}, amount={}", caller, request.amount());

        return webClient.post()
                .uri("/api/v1/ledger/deposit")
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(DepositResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<WithdrawalResponse> withdraw(String caller, WithdrawalRequest request) {
        log.debug("Calling withdraw: caller={}, amount={}", caller, request.amount());

        return webClient.post()
                .uri("/api/v1/ledger/withdraw")
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(WithdrawalResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BalanceResponse> getBalance(String principal) {
        log.debug("Calling getBalance: principal={}", principal);

        return webClient.get()
                .uri("/api/v1/ledger/accounts/{principal}/balance", principal)
                .retrieve()
                .toEntity(BalanceResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<TransferResponse> transferWithFee(String caller, TransferRequest request) {
        log.debug("Calling transferWithFee: from={}, to={}, amount={}",
                caller, request.recipient(), request.amount());

        return webClient.post()
                .uri("/api/v1/ledger/transfer")
                .header(ApiHeaders.CALLER_ID, caller)
                .bodyValue(request)
                .retrieve()
                .toEntity(TransferResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<LedgerEntryDTO>> getEntries(UUID referenceId) {
        log.debug("Calling getEntries: referenceId={}", referenceId);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/ledger/entries")
                        .queryParam("referenceId", referenceId)
                        .build())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<LedgerEntryDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<ReconciliationResponse> reconcile(String asset) {
        log.debug("Calling reconcile: asset={}", asset);

        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/api/v1/ledger/reconciliation");
                    if (asset != null) {
                        uriBuilder.queryParam("asset", asset);
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .toEntity(ReconciliationResponse.class)
                .block();
    }
}
