package com.nosota.msettle.controller;

import com.nosota.msettle.api.EscrowApi;
import com.nosota.msettle.api.request.CreateEscrowRequest;
import com.nosota.msettle.api.request.ResolveEscrowRequest;
import com.nosota.msettle.api.response.EscrowResponse;
import com.nosota.msettle.mapper.EscrowMapper;
import com.nosota.msettle.model.Escrow;
import com.nosota.msettle.service.EscrowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for two-party escrows.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class EscrowController implements EscrowApi {

    private final EscrowService escrowService;

    @Override
    public ResponseEntity<EscrowResponse> createEscrow(String caller, CreateEscrowRequest request) throws Exception {
        Escrow escrow = escrowService.createEscrow(caller, request.seller(), request.amount(),
                request.expiresInSeconds(), request.arbiter(), request.feeBps(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(EscrowMapper.INSTANCE.toResponse(escrow));
    }

    @Override
    public ResponseEntity<EscrowResponse> releaseEscrow(String caller, UUID escrowId) throws Exception {
        return ok(escrowService.releaseEscrow(escrowId, caller));
    }

    @Override
    public ResponseEntity<EscrowResponse> refundEscrow(String caller, UUID escrowId) throws Exception {
        return ok(escrowService.refundEscrow(escrowId, caller));
    }

    @Override
    public ResponseEntity<EscrowResponse> disputeEscrow(String caller, UUID escrowId) throws Exception {
        return ok(escrowService.disputeEscrow(escrowId, caller));
    }

    @Override
    public ResponseEntity<EscrowResponse> resolveEscrow(String caller, UUID escrowId, ResolveEscrowRequest request)
            throws Exception {
        return ok(escrowService.resolveEscrow(escrowId, caller, request.winner()));
    }

    @Override
    public ResponseEntity<EscrowResponse> claimExpiredEscrow(String caller, UUID escrowId) throws Exception {
        return ok(escrowService.claimExpiredEscrow(escrowId, caller));
    }

    @Override
    public ResponseEntity<EscrowResponse> getEscrow(UUID escrowId) {
        return ok(escrowService.getEscrow(escrowId));
    }

    @Override
    public ResponseEntity<List<EscrowResponse>> getEscrowsByParticipant(String participant) {
        List<Escrow> escrows = escrowService.getEscrowsByParticipant(participant);
        return ResponseEntity.ok(EscrowMapper.INSTANCE.toResponseList(escrows));
    }

    private static ResponseEntity<EscrowResponse> ok(Escrow escrow) {
        return ResponseEntity.ok(EscrowMapper.INSTANCE.toResponse(escrow));
    }
}
