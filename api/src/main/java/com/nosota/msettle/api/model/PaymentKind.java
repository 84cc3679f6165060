package com.nosota.msettle.api.model;

/**
 * Payment primitives supported by the payment scheduler.
 */
public enum PaymentKind {
    DIRECT,
    SCHEDULED,
    CONDITIONAL,
    RECURRING,
    SPLIT,
    BATCH
}
