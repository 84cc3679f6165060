package com.nosota.msettle.service;

import com.nosota.msettle.api.model.CommandType;
import com.nosota.msettle.error.ExternalCallFailedException;
import com.nosota.msettle.error.SettlementException;
import com.nosota.msettle.model.PendingTransaction;
import com.nosota.msettle.model.SystemAccounts;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.UUID;

/**
 * Executes multi-sig transactions: debit first, external call second.
 *
 * <p>The method itself runs outside any transaction. {@link MultiSigWalletService#claimExecution}
 * commits the executed flag and the ledger movement in its own transaction; only then is the
 * destination of a FORWARD command invoked. A destination that calls back into {@code execute}
 * for the same transaction is rejected because the flag is already visible.
 *
 * <p>A failing call does not undo the committed execution: the value stays with the destination
 * and the caller receives {@link ExternalCallFailedException}.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class MultiSigExecutionService {

    private final MultiSigWalletService multiSigWalletService;
    private final ExternalCallGateway externalCallGateway;

    @Transactional(Transactional.TxType.NOT_SUPPORTED)
    public PendingTransaction executeTransaction(@NotNull UUID walletId, @NotNull Long txIndex, String caller)
            throws SettlementException {
        PendingTransaction transaction = multiSigWalletService.claimExecution(walletId, txIndex, caller);

        if (transaction.getCommand() == CommandType.FORWARD) {
            try {
                externalCallGateway.invoke(SystemAccounts.multiSig(walletId), transaction.getDestination(),
                        transaction.getValue(), transaction.getPayload());
            } catch (Exception e) {
                log.error("Forwarded call of transaction #{} on wallet {} to {} failed: {}",
                        txIndex, walletId, transaction.getDestination(), e.getMessage());
                throw new ExternalCallFailedException(
                        String.format("Call to %s failed for transaction #%d of wallet %s",
                                transaction.getDestination(), txIndex, walletId), e);
            }
        }

        return transaction;
    }
}
