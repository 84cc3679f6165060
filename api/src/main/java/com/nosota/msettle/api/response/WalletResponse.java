package com.nosota.msettle.api.response;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response describing a multi-sig wallet.
 *
 * @param balance Native custody balance of the wallet
 */
public record WalletResponse(
        UUID id,
        String admin,
        List<String> owners,
        Integer threshold,
        Boolean active,
        Long transactionCount,
        Long balance,
        Instant createdAt
) {}
