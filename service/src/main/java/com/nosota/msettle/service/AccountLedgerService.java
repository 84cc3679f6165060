package com.nosota.msettle.service;

import com.nosota.msettle.api.model.Assets;
import com.nosota.msettle.api.model.TransactionType;
import com.nosota.msettle.api.response.ReconciliationResponse;
import com.nosota.msettle.dto.TransferResult;
import com.nosota.msettle.error.InsufficientFundsException;
import com.nosota.msettle.error.SettlementException;
import com.nosota.msettle.error.ValidationException;
import com.nosota.msettle.event.SettlementEventKind;
import com.nosota.msettle.event.SettlementEventPublisher;
import com.nosota.msettle.model.AccountBalance;
import com.nosota.msettle.model.LedgerEntry;
import com.nosota.msettle.model.SystemAccounts;
import com.nosota.msettle.repository.AccountBalanceRepository;
import com.nosota.msettle.repository.LedgerEntryRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Balances of every principal in the native currency and in fungible tokens.
 *
 * <p>Every mutation:
 * <ul>
 *   <li>locks the affected balance rows (PESSIMISTIC_WRITE)</li>
 *   <li>checks all preconditions before changing anything</li>
 *   <li>writes one journal entry per changed balance, under the caller's reference id</li>
 * </ul>
 *
 * <p>Protocol services (escrow, auctions, payments, multi-sig) call {@link #credit},
 * {@link #debit}, {@link #transfer} and {@link #transferWithFee} inside their own transaction;
 * the methods join it, so a protocol operation is all-or-nothing across several accounts.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class AccountLedgerService {

    private final AccountBalanceRepository accountBalanceRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final FeePolicy feePolicy;
    private final IdGenerator idGenerator;
    private final SettlementEventPublisher eventPublisher;
    private final Clock clock;

    // ==================== Core mutations ====================

    /**
     * Credits an account, creating it on first use.
     *
     * @param principal   Account owner
     * @param asset       {@code NATIVE} (or null) for the native currency, otherwise a token id
     * @param amount      Positive amount
     * @param referenceId Reference for the journal entry
     * @param description Journal description
     * @return New balance
     * @throws ValidationException if the amount is not positive or the balance would overflow
     */
    @Transactional(rollbackOn = SettlementException.class)
    public long credit(@NotNull String principal, String asset, long amount,
                       UUID referenceId, String description) throws ValidationException {
        CallerGuard.requirePositive(amount, "Credit amount");
        String normalizedAsset = normalize(asset);

        AccountBalance account = accountBalanceRepository.findForUpdate(principal, normalizedAsset)
                .orElseGet(() -> newAccount(principal, normalizedAsset));

        long newBalance;
        try {
            newBalance = Math.addExact(account.getBalance(), amount);
        } catch (ArithmeticException e) {
            throw new ValidationException(
                    String.format("Balance overflow crediting %d %s to %s", amount, normalizedAsset, principal), e);
        }

        account.setBalance(newBalance);
        account.setUpdatedAt(clock.instant());
        accountBalanceRepository.save(account);
        record(referenceId, principal, normalizedAsset, amount, TransactionType.CREDIT, description);

        log.debug("Credited {} {} to {} (ref={}), balance={}", amount, normalizedAsset, principal, referenceId, newBalance);
        return newBalance;
    }

    /**
     * Debits an account.
     *
     * @return New balance
     * @throws ValidationException        if the amount is not positive
     * @throws InsufficientFundsException if the balance is lower than the amount
     */
    @Transactional(rollbackOn = SettlementException.class)
    public long debit(@NotNull String principal, String asset, long amount,
                      UUID referenceId, String description) throws SettlementException {
        CallerGuard.requirePositive(amount, "Debit amount");
        String normalizedAsset = normalize(asset);

        AccountBalance account = accountBalanceRepository.findForUpdate(principal, normalizedAsset)
                .orElse(null);
        long current = account == null ? 0L : account.getBalance();
        if (current < amount) {
            throw new InsufficientFundsException(
                    String.format("Insufficient funds in %s (%s): balance %d, required %d",
                            principal, normalizedAsset, current, amount));
        }

        long newBalance = current - amount;
        account.setBalance(newBalance);
        account.setUpdatedAt(clock.instant());
        accountBalanceRepository.save(account);
        record(referenceId, principal, normalizedAsset, -amount, TransactionType.DEBIT, description);

        log.debug("Debited {} {} from {} (ref={}), balance={}", amount, normalizedAsset, principal, referenceId, newBalance);
        return newBalance;
    }

    /**
     * Moves an amount between two accounts without a fee. Used for custody in and out.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public void transfer(@NotNull String from, @NotNull String to, String asset, long amount,
                         UUID referenceId, String description) throws SettlementException {
        if (from.equals(to)) {
            throw new ValidationException("Cannot transfer to the same account: " + from);
        }
        debit(from, asset, amount, referenceId, description);
        credit(to, asset, amount, referenceId, description);
    }

    /**
     * Moves native currency from {@code from} to {@code to}, skimming the platform fee.
     *
     * <p>{@code from} loses {@code amount}; {@code to} gains {@code amount - fee}; the platform
     * gains {@code fee}. The platform entry is skipped when the fee is zero.
     *
     * @param feeBps Fee rate; clamped by {@link FeePolicy}
     * @return Fee breakdown
     */
    @Transactional(rollbackOn = SettlementException.class)
    public TransferResult transferWithFee(@NotNull String from, @NotNull String to, long amount, int feeBps,
                                          UUID referenceId, String description) throws SettlementException {
        CallerGuard.requirePositive(amount, "Transfer amount");
        if (from.equals(to)) {
            throw new ValidationException("Cannot transfer to the same account: " + from);
        }

        long fee = feePolicy.compute(amount, feeBps);
        long net = amount - fee;

        debit(from, Assets.NATIVE, amount, referenceId, description);
        if (net > 0) {
            credit(to, Assets.NATIVE, net, referenceId, description);
        }
        if (fee > 0) {
            credit(SystemAccounts.PLATFORM, Assets.NATIVE, fee, referenceId, "Platform fee: " + description);
        }

        log.info("Transfer {} -> {}: amount={}, fee={}, net={} (ref={})", from, to, amount, fee, net, referenceId);
        return TransferResult.builder()
                .referenceId(referenceId)
                .amount(amount)
                .fee(fee)
                .netAmount(net)
                .build();
    }

    // ==================== Caller operations ====================

    /**
     * Credits the caller with funds arriving from outside the ledger.
     *
     * @return Reference id of the deposit
     */
    @Transactional(rollbackOn = SettlementException.class)
    public UUID deposit(String caller, String asset, long amount, String externalReference) throws SettlementException {
        CallerGuard.requireCaller(caller);
        UUID referenceId = idGenerator.nextId();
        String description = externalReference == null ? "Deposit" : "Deposit: " + externalReference;

        credit(caller, asset, amount, referenceId, description);
        eventPublisher.publish(referenceId, SettlementEventKind.DEPOSITED);

        log.info("Deposit {} {} to {} (ref={})", amount, normalize(asset), caller, referenceId);
        return referenceId;
    }

    /**
     * Debits the caller, moving funds out of the ledger.
     *
     * @return Reference id of the withdrawal
     */
    @Transactional(rollbackOn = SettlementException.class)
    public UUID withdraw(String caller, String asset, long amount, String destinationAccount) throws SettlementException {
        CallerGuard.requireCaller(caller);
        UUID referenceId = idGenerator.nextId();
        String description = destinationAccount == null ? "Withdrawal" : "Withdrawal to " + destinationAccount;

        debit(caller, asset, amount, referenceId, description);
        eventPublisher.publish(referenceId, SettlementEventKind.WITHDRAWN);

        log.info("Withdrawal {} {} from {} (ref={})", amount, normalize(asset), caller, referenceId);
        return referenceId;
    }

    /**
     * Fee-skimmed transfer initiated by the sender.
     *
     * @param feeBps Requested rate, or null for the configured default
     */
    @Transactional(rollbackOn = SettlementException.class)
    public TransferResult transferFromCaller(String caller, String recipient, long amount,
                                             Integer feeBps) throws SettlementException {
        CallerGuard.requireCaller(caller);
        CallerGuard.requireParticipant(recipient, "Recipient");

        UUID referenceId = idGenerator.nextId();
        TransferResult result = transferWithFee(caller, recipient, amount, feePolicy.resolve(feeBps),
                referenceId, "Transfer " + caller + " -> " + recipient);
        eventPublisher.publish(referenceId, SettlementEventKind.TRANSFERRED);
        return result;
    }

    // ==================== Queries ====================

    public long getBalance(@NotNull String principal, String asset) {
        return accountBalanceRepository.findByPrincipalAndAsset(principal, normalize(asset))
                .map(AccountBalance::getBalance)
                .orElse(0L);
    }

    /**
     * All non-native balances of a principal, keyed by token id.
     */
    public Map<String, Long> getTokenBalances(@NotNull String principal) {
        Map<String, Long> tokens = new LinkedHashMap<>();
        for (AccountBalance account : accountBalanceRepository.findAllByPrincipal(principal)) {
            if (!Assets.isNative(account.getAsset()) && account.getBalance() != 0) {
                tokens.put(account.getAsset(), account.getBalance());
            }
        }
        return tokens;
    }

    public List<LedgerEntry> getEntries(@NotNull UUID referenceId) {
        return ledgerEntryRepository.findByReferenceIdOrderByIdAsc(referenceId);
    }

    /**
     * Compares the sum of all balances of an asset with the sum of its journal entries.
     */
    public ReconciliationResponse reconcile(String asset) {
        String normalizedAsset = normalize(asset);
        Long totalBalances = accountBalanceRepository.sumBalancesByAsset(normalizedAsset);
        Long journalSum = ledgerEntryRepository.sumAmountsByAsset(normalizedAsset);
        boolean consistent = totalBalances.equals(journalSum);
        if (!consistent) {
            log.error("Ledger inconsistency for {}: balances={}, journal={}", normalizedAsset, totalBalances, journalSum);
        }
        return new ReconciliationResponse(normalizedAsset, totalBalances, journalSum, consistent);
    }

    // ==================== Internals ====================

    private AccountBalance newAccount(String principal, String asset) {
        AccountBalance account = new AccountBalance();
        account.setPrincipal(principal);
        account.setAsset(asset);
        account.setBalance(0L);
        return account;
    }

    private void record(UUID referenceId, String principal, String asset, long signedAmount,
                        TransactionType type, String description) {
        LedgerEntry entry = new LedgerEntry();
        entry.setReferenceId(referenceId);
        entry.setPrincipal(principal);
        entry.setAsset(asset);
        entry.setAmount(signedAmount);
        entry.setType(type);
        entry.setDescription(description);
        entry.setCreatedAt(clock.instant());
        ledgerEntryRepository.save(entry);
    }

    private static String normalize(String asset) {
        return Assets.isNative(asset) ? Assets.NATIVE : asset;
    }
}
