package com.nosota.msettle.api.response;

/**
 * Response for reconciliation check.
 *
 * @param asset         Reconciled asset
 * @param totalBalances Sum of all account balances for the asset
 * @param journalSum    Sum of all ledger entries for the asset
 * @param consistent    Whether both sums match
 */
public record ReconciliationResponse(
        String asset,
        Long totalBalances,
        Long journalSum,
        boolean consistent
) {}
