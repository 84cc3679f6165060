package com.nosota.msettle.api.request;

import java.util.List;

/**
 * Proof submitted by the verifier of a conditional payment.
 *
 * @param signers Principals that approved (SIGNATURES conditions)
 * @param note    Free-form evidence reference, recorded in logs only
 */
public record FulfillConditionRequest(
        List<String> signers,
        String note
) {
}
