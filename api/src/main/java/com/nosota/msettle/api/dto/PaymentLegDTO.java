package com.nosota.msettle.api.dto;

/**
 * Settled share of a payment for one recipient.
 *
 * @param recipient   Receiving principal
 * @param grossAmount Amount before fee
 * @param fee         Platform fee skimmed from the share
 * @param netAmount   Amount credited to the recipient
 * @param percentage  Split percentage (SPLIT payments only)
 */
public record PaymentLegDTO(
        String recipient,
        Long grossAmount,
        Long fee,
        Long netAmount,
        Integer percentage
) {}
