package com.nosota.msettle.api.model;

/**
 * Release condition attached to a conditional payment.
 */
public enum ConditionType {
    /**
     * Satisfied once the clock reaches the condition's not-before time.
     */
    TIME,

    /**
     * Satisfied when the proof lists at least {@code threshold} distinct required signers.
     */
    SIGNATURES,

    /**
     * Satisfied when the condition's target address has code registered in the call gateway.
     */
    CONTRACT_PRESENCE,

    /**
     * Left to the verifier's judgment: fulfilling the payment is the approval.
     */
    CUSTOM
}
