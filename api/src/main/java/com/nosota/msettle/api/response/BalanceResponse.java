package com.nosota.msettle.api.response;

import java.util.Map;

/**
 * Response for balance query.
 *
 * @param principal     Account owner
 * @param nativeBalance Native currency balance
 * @param tokens        Token balances keyed by token id (zero balances omitted)
 */
public record BalanceResponse(
        String principal,
        Long nativeBalance,
        Map<String, Long> tokens
) {}
