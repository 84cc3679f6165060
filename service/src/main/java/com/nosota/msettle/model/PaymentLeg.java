package com.nosota.msettle.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One recipient of a split or batch payment.
 */
@Embeddable
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class PaymentLeg {
    @Column(nullable = false, length = 128)
    private String recipient;

    @Column(name = "gross_amount", nullable = false)
    private Long grossAmount;

    @Column(nullable = false)
    private Long fee;

    @Column(name = "net_amount", nullable = false)
    private Long netAmount;

    /**
     * Share in percent; null for batch legs.
     */
    private Integer percentage;
}
