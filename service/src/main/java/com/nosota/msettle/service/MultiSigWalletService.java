package com.nosota.msettle.service;

import com.nosota.msettle.api.model.Assets;
import com.nosota.msettle.api.model.CommandType;
import com.nosota.msettle.error.*;
import com.nosota.msettle.event.SettlementEventKind;
import com.nosota.msettle.event.SettlementEventPublisher;
import com.nosota.msettle.model.MultiSigWallet;
import com.nosota.msettle.model.PendingTransaction;
import com.nosota.msettle.model.SystemAccounts;
import com.nosota.msettle.repository.MultiSigWalletRepository;
import com.nosota.msettle.repository.PendingTransactionRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * N-of-M wallets: funds leave only after enough current owners confirmed a pending transaction.
 *
 * <p>All methods here run in one JPA transaction each. The execution of a pending transaction is
 * split in two: {@link #claimExecution} commits the executed flag and the debit, and
 * {@link MultiSigExecutionService} then performs the external call outside any transaction.
 *
 * <p>Commands:
 * <ul>
 *   <li>TRANSFER: {@code value} to {@code destination}</li>
 *   <li>FORWARD: {@code value} to {@code destination}, then {@code payload} is handed to its code</li>
 *   <li>ADD_OWNER / REMOVE_OWNER: {@code destination} is the owner</li>
 *   <li>CHANGE_THRESHOLD: {@code value} is the new threshold</li>
 * </ul>
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class MultiSigWalletService {

    private final MultiSigWalletRepository walletRepository;
    private final PendingTransactionRepository pendingTransactionRepository;
    private final AccountLedgerService accountLedgerService;
    private final IdGenerator idGenerator;
    private final SettlementEventPublisher eventPublisher;
    private final Clock clock;

    // ==================== Wallet ====================

    /**
     * Creates a wallet administered by the caller.
     *
     * @param owners    Distinct owners, at least one
     * @param threshold Confirmations needed, {@code 1 <= threshold <= owners}
     */
    @Transactional(rollbackOn = SettlementException.class)
    public MultiSigWallet createWallet(String caller, @NotNull List<String> owners, @NotNull Integer threshold)
            throws SettlementException {
        CallerGuard.requireCaller(caller);
        if (owners.isEmpty()) {
            throw new ValidationException("At least one owner is required");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String owner : owners) {
            CallerGuard.requireParticipant(owner, "Owner");
            if (!distinct.add(owner)) {
                throw new ValidationException("Duplicate owner: " + owner);
            }
        }
        validateThreshold(threshold, distinct.size());

        MultiSigWallet wallet = new MultiSigWallet();
        wallet.setId(idGenerator.nextId());
        wallet.setAdmin(caller);
        wallet.setOwners(new ArrayList<>(distinct));
        wallet.setThreshold(threshold);
        wallet.setActive(true);
        wallet.setTransactionCount(0L);
        wallet.setCreatedAt(clock.instant());
        wallet = walletRepository.save(wallet);

        eventPublisher.publish(wallet.getId(), SettlementEventKind.WALLET_CREATED);
        log.info("Created multi-sig wallet {}: admin={}, owners={}, threshold={}",
                wallet.getId(), caller, wallet.getOwners(), threshold);
        return wallet;
    }

    /**
     * Moves native funds from the caller into the wallet's custody. Anyone may deposit.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public MultiSigWallet depositToWallet(@NotNull UUID walletId, String caller, Long amount)
            throws SettlementException {
        CallerGuard.requireCaller(caller);
        CallerGuard.requirePositive(amount, "Deposit amount");
        MultiSigWallet wallet = getWallet(walletId);
        requireActive(wallet);

        accountLedgerService.transfer(caller, SystemAccounts.multiSig(walletId), Assets.NATIVE, amount,
                walletId, "Multi-sig deposit");

        eventPublisher.publish(walletId, SettlementEventKind.WALLET_DEPOSITED);
        log.info("Deposited {} into multi-sig wallet {} from {}", amount, walletId, caller);
        return wallet;
    }

    @Transactional(rollbackOn = SettlementException.class)
    public MultiSigWallet addOwner(@NotNull UUID walletId, String caller, String owner) throws SettlementException {
        MultiSigWallet wallet = getWalletForUpdate(walletId);
        requireAdmin(wallet, caller);
        requireActive(wallet);
        applyAddOwner(wallet, owner);
        return walletRepository.save(wallet);
    }

    @Transactional(rollbackOn = SettlementException.class)
    public MultiSigWallet removeOwner(@NotNull UUID walletId, String caller, String owner) throws SettlementException {
        MultiSigWallet wallet = getWalletForUpdate(walletId);
        requireAdmin(wallet, caller);
        requireActive(wallet);
        applyRemoveOwner(wallet, owner);
        return walletRepository.save(wallet);
    }

    @Transactional(rollbackOn = SettlementException.class)
    public MultiSigWallet changeThreshold(@NotNull UUID walletId, String caller, @NotNull Integer threshold)
            throws SettlementException {
        MultiSigWallet wallet = getWalletForUpdate(walletId);
        requireAdmin(wallet, caller);
        requireActive(wallet);
        applyChangeThreshold(wallet, threshold);
        return walletRepository.save(wallet);
    }

    /**
     * Deactivates an empty wallet. Admin only.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public MultiSigWallet deactivateWallet(@NotNull UUID walletId, String caller) throws SettlementException {
        MultiSigWallet wallet = getWalletForUpdate(walletId);
        requireAdmin(wallet, caller);
        requireActive(wallet);
        long balance = getWalletBalance(walletId);
        if (balance != 0) {
            throw new InvalidStateException(
                    String.format("Wallet %s still holds %d and cannot be deactivated", walletId, balance));
        }

        wallet.setActive(false);
        wallet = walletRepository.save(wallet);
        eventPublisher.publish(walletId, SettlementEventKind.WALLET_DEACTIVATED);
        log.info("Deactivated multi-sig wallet {}", walletId);
        return wallet;
    }

    // ==================== Pending transactions ====================

    /**
     * Proposes a transaction. The proposer's confirmation is recorded immediately.
     *
     * @return The pending transaction with its wallet-scoped index
     */
    @Transactional(rollbackOn = SettlementException.class)
    public PendingTransaction proposeTransaction(@NotNull UUID walletId, String caller, @NotNull CommandType command,
                                                 String destination, Long value, byte[] payload, String argument)
            throws SettlementException {
        MultiSigWallet wallet = getWalletForUpdate(walletId);
        requireActive(wallet);
        requireOwner(wallet, caller);

        long txValue = value == null ? 0L : value;
        if (txValue < 0) {
            throw new ValidationException("Value must not be negative");
        }
        validateCommand(wallet, command, destination, txValue);

        PendingTransaction transaction = new PendingTransaction();
        transaction.setId(idGenerator.nextId());
        transaction.setWalletId(walletId);
        transaction.setTxIndex(wallet.getTransactionCount());
        transaction.setCreator(caller);
        transaction.setCommand(command);
        transaction.setDestination(destination);
        transaction.setValue(txValue);
        transaction.setPayload(payload);
        transaction.setArgument(argument);
        transaction.getConfirmations().add(caller);
        transaction.setCreatedAt(clock.instant());
        transaction = pendingTransactionRepository.save(transaction);

        wallet.setTransactionCount(wallet.getTransactionCount() + 1);
        walletRepository.save(wallet);

        eventPublisher.publish(transaction.getId(), SettlementEventKind.TRANSACTION_PROPOSED);
        log.info("Proposed transaction #{} on wallet {}: command={}, destination={}, value={}, by {}",
                transaction.getTxIndex(), walletId, command, destination, txValue, caller);
        return transaction;
    }

    @Transactional(rollbackOn = SettlementException.class)
    public PendingTransaction confirmTransaction(@NotNull UUID walletId, @NotNull Long txIndex, String caller)
            throws SettlementException {
        MultiSigWallet wallet = getWallet(walletId);
        requireOwner(wallet, caller);
        PendingTransaction transaction = getTransactionForUpdate(walletId, txIndex);
        requireOpen(transaction);
        if (transaction.getConfirmations().contains(caller)) {
            throw new InvalidStateException(
                    String.format("Transaction #%d already confirmed by %s", txIndex, caller));
        }

        transaction.getConfirmations().add(caller);
        transaction = pendingTransactionRepository.save(transaction);

        eventPublisher.publish(transaction.getId(), SettlementEventKind.TRANSACTION_CONFIRMED);
        log.info("Transaction #{} on wallet {} confirmed by {} ({} confirmations)",
                txIndex, walletId, caller, transaction.getConfirmations().size());
        return transaction;
    }

    @Transactional(rollbackOn = SettlementException.class)
    public PendingTransaction revokeConfirmation(@NotNull UUID walletId, @NotNull Long txIndex, String caller)
            throws SettlementException {
        MultiSigWallet wallet = getWallet(walletId);
        requireOwner(wallet, caller);
        PendingTransaction transaction = getTransactionForUpdate(walletId, txIndex);
        requireOpen(transaction);
        if (!transaction.getConfirmations().remove(caller)) {
            throw new InvalidStateException(
                    String.format("Transaction #%d is not confirmed by %s", txIndex, caller));
        }

        transaction = pendingTransactionRepository.save(transaction);
        eventPublisher.publish(transaction.getId(), SettlementEventKind.CONFIRMATION_REVOKED);
        log.info("Confirmation of {} on transaction #{} of wallet {} revoked", caller, txIndex, walletId);
        return transaction;
    }

    /**
     * Marks a confirmed transaction executed and applies its ledger and owner effects.
     *
     * <p>Commits before the external call of a FORWARD command is made, so a call that
     * re-enters {@code execute} sees the transaction as executed.
     *
     * @throws ThresholdException if fewer than threshold current owners confirmed
     */
    @Transactional(rollbackOn = SettlementException.class)
    public PendingTransaction claimExecution(@NotNull UUID walletId, @NotNull Long txIndex, String caller)
            throws SettlementException {
        MultiSigWallet wallet = getWalletForUpdate(walletId);
        requireActive(wallet);
        requireOwner(wallet, caller);
        PendingTransaction transaction = getTransactionForUpdate(walletId, txIndex);
        requireOpen(transaction);

        long confirmations = countValidConfirmations(wallet, transaction);
        if (confirmations < wallet.getThreshold()) {
            throw new ThresholdException(String.format(
                    "Transaction #%d has %d valid confirmations, %d required",
                    txIndex, confirmations, wallet.getThreshold()));
        }

        CommandType command = transaction.getCommand();
        if (command.movesValue()) {
            long balance = getWalletBalance(walletId);
            if (balance < transaction.getValue()) {
                throw new InsufficientFundsException(String.format(
                        "Wallet %s holds %d, transaction #%d needs %d", walletId, balance, txIndex, transaction.getValue()));
            }
        }

        transaction.setExecuted(true);
        transaction.setExecutedAt(clock.instant());
        transaction = pendingTransactionRepository.save(transaction);

        switch (command) {
            case TRANSFER, FORWARD -> {
                if (transaction.getValue() > 0) {
                    accountLedgerService.transfer(SystemAccounts.multiSig(walletId), transaction.getDestination(),
                            Assets.NATIVE, transaction.getValue(), walletId,
                            "Multi-sig transaction #" + txIndex);
                }
            }
            case ADD_OWNER -> applyAddOwner(wallet, transaction.getDestination());
            case REMOVE_OWNER -> applyRemoveOwner(wallet, transaction.getDestination());
            case CHANGE_THRESHOLD -> applyChangeThreshold(wallet, Math.toIntExact(transaction.getValue()));
        }
        walletRepository.save(wallet);

        eventPublisher.publish(transaction.getId(), SettlementEventKind.TRANSACTION_EXECUTED);
        log.info("Executed transaction #{} on wallet {}: command={}, value={}, by {}",
                txIndex, walletId, command, transaction.getValue(), caller);
        return transaction;
    }

    /**
     * Cancels a transaction that has not been executed. Creator or admin only.
     */
    @Transactional(rollbackOn = SettlementException.class)
    public PendingTransaction cancelTransaction(@NotNull UUID walletId, @NotNull Long txIndex, String caller)
            throws SettlementException {
        MultiSigWallet wallet = getWallet(walletId);
        PendingTransaction transaction = getTransactionForUpdate(walletId, txIndex);
        if (!transaction.getCreator().equals(caller) && !wallet.getAdmin().equals(caller)) {
            throw new AuthorizationException(
                    String.format("Only the creator or the admin may cancel transaction #%d, caller: %s", txIndex, caller));
        }
        requireOpen(transaction);

        transaction.setCancelled(true);
        transaction = pendingTransactionRepository.save(transaction);

        eventPublisher.publish(transaction.getId(), SettlementEventKind.TRANSACTION_CANCELLED);
        log.info("Cancelled transaction #{} on wallet {} by {}", txIndex, walletId, caller);
        return transaction;
    }

    // ==================== Queries ====================

    public MultiSigWallet getWallet(@NotNull UUID walletId) {
        return walletRepository.findById(walletId)
                .orElseThrow(() -> new EntityNotFoundException("Multi-sig wallet not found: " + walletId));
    }

    public PendingTransaction getTransaction(@NotNull UUID walletId, @NotNull Long txIndex) {
        return pendingTransactionRepository.findByWalletIdAndTxIndex(walletId, txIndex)
                .orElseThrow(() -> new EntityNotFoundException(
                        String.format("Transaction #%d not found in wallet %s", txIndex, walletId)));
    }

    public long getWalletBalance(@NotNull UUID walletId) {
        return accountLedgerService.getBalance(SystemAccounts.multiSig(walletId), Assets.NATIVE);
    }

    /**
     * Confirmations given by principals that are still owners. Removed owners do not count.
     */
    public long countValidConfirmations(MultiSigWallet wallet, PendingTransaction transaction) {
        return transaction.getConfirmations().stream()
                .filter(wallet.getOwners()::contains)
                .count();
    }

    // ==================== Internals ====================

    private MultiSigWallet getWalletForUpdate(UUID walletId) {
        return walletRepository.findByIdForUpdate(walletId)
                .orElseThrow(() -> new EntityNotFoundException("Multi-sig wallet not found: " + walletId));
    }

    private PendingTransaction getTransactionForUpdate(UUID walletId, Long txIndex) {
        return pendingTransactionRepository.findForUpdate(walletId, txIndex)
                .orElseThrow(() -> new EntityNotFoundException(
                        String.format("Transaction #%d not found in wallet %s", txIndex, walletId)));
    }

    private void validateCommand(MultiSigWallet wallet, CommandType command, String destination, long value)
            throws SettlementException {
        switch (command) {
            case TRANSFER, FORWARD -> {
                CallerGuard.requireParticipant(destination, "Destination");
                if (command == CommandType.TRANSFER && value == 0) {
                    throw new ValidationException("Transfer value must be positive");
                }
                long balance = getWalletBalance(wallet.getId());
                if (balance < value) {
                    throw new InsufficientFundsException(String.format(
                            "Wallet %s holds %d, proposal needs %d", wallet.getId(), balance, value));
                }
            }
            case ADD_OWNER -> {
                CallerGuard.requireParticipant(destination, "Owner");
                if (wallet.getOwners().contains(destination)) {
                    throw new ValidationException("Already an owner: " + destination);
                }
            }
            case REMOVE_OWNER -> {
                if (!wallet.getOwners().contains(destination)) {
                    throw new ValidationException("Not an owner: " + destination);
                }
                if (wallet.getOwners().size() - 1 < wallet.getThreshold()) {
                    throw new ValidationException("Removing " + destination + " would leave fewer owners than the threshold");
                }
            }
            case CHANGE_THRESHOLD -> validateThreshold(value, wallet.getOwners().size());
        }
    }

    private void applyAddOwner(MultiSigWallet wallet, String owner) throws SettlementException {
        CallerGuard.requireParticipant(owner, "Owner");
        if (wallet.getOwners().contains(owner)) {
            throw new ValidationException("Already an owner: " + owner);
        }
        wallet.getOwners().add(owner);
        eventPublisher.publish(wallet.getId(), SettlementEventKind.OWNER_ADDED);
        log.info("Added owner {} to wallet {}", owner, wallet.getId());
    }

    private void applyRemoveOwner(MultiSigWallet wallet, String owner) throws SettlementException {
        if (!wallet.getOwners().contains(owner)) {
            throw new ValidationException("Not an owner: " + owner);
        }
        if (wallet.getOwners().size() - 1 < wallet.getThreshold()) {
            throw new ValidationException(
                    String.format("Removing %s would leave %d owners for threshold %d",
                            owner, wallet.getOwners().size() - 1, wallet.getThreshold()));
        }
        wallet.getOwners().remove(owner);
        eventPublisher.publish(wallet.getId(), SettlementEventKind.OWNER_REMOVED);
        log.info("Removed owner {} from wallet {}", owner, wallet.getId());
    }

    private void applyChangeThreshold(MultiSigWallet wallet, int threshold) throws SettlementException {
        validateThreshold(threshold, wallet.getOwners().size());
        wallet.setThreshold(threshold);
        eventPublisher.publish(wallet.getId(), SettlementEventKind.THRESHOLD_CHANGED);
        log.info("Threshold of wallet {} changed to {}", wallet.getId(), threshold);
    }

    private void validateThreshold(long threshold, int ownerCount) throws ValidationException {
        if (threshold < 1 || threshold > ownerCount) {
            throw new ValidationException(
                    String.format("Threshold must be within [1, %d], got %d", ownerCount, threshold));
        }
    }

    private void requireOwner(MultiSigWallet wallet, String caller) throws AuthorizationException {
        if (caller == null || !wallet.getOwners().contains(caller)) {
            throw new AuthorizationException(
                    String.format("Caller %s is not an owner of wallet %s", caller, wallet.getId()));
        }
    }

    private void requireAdmin(MultiSigWallet wallet, String caller) throws AuthorizationException {
        if (!wallet.getAdmin().equals(caller)) {
            throw new AuthorizationException(
                    String.format("Caller %s is not the admin of wallet %s", caller, wallet.getId()));
        }
    }

    private void requireActive(MultiSigWallet wallet) throws InvalidStateException {
        if (!Boolean.TRUE.equals(wallet.getActive())) {
            throw new InvalidStateException("Wallet is not active: " + wallet.getId());
        }
    }

    private void requireOpen(PendingTransaction transaction) throws InvalidStateException {
        if (transaction.isExecuted()) {
            throw new InvalidStateException(
                    String.format("Transaction #%d of wallet %s is already executed",
                            transaction.getTxIndex(), transaction.getWalletId()));
        }
        if (transaction.isCancelled()) {
            throw new InvalidStateException(
                    String.format("Transaction #%d of wallet %s is cancelled",
                            transaction.getTxIndex(), transaction.getWalletId()));
        }
    }
}
