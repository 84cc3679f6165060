package com.nosota.msettle.scheduler;

import com.nosota.msettle.error.SettlementException;
import com.nosota.msettle.service.PaymentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Settles scheduled payments and recurring installments once their release time has passed.
 *
 * <p>Each payment is executed in its own transaction, so one failure does not hold back the rest.
 * Execution stays open to any caller; this job is only a convenience trigger.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   payment-keeper:
 *     enabled: true          # enable/disable keeper
 *     cron: "0 * * * * *"    # every minute
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.payment-keeper.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class DuePaymentKeeper {

    static final String KEEPER_CALLER = "payment-keeper";

    private final PaymentService paymentService;

    @Scheduled(cron = "${scheduler.payment-keeper.cron:0 * * * * *}")
    public void executeDuePayments() {
        log.debug("Starting scheduled job: execute due payments");

        int executed = runOnce();
        if (executed > 0) {
            log.info("Executed {} due payments", executed);
        } else {
            log.debug("No due payments found");
        }
    }

    /**
     * Executes every payment due right now.
     *
     * @return Number of payments settled
     */
    public int runOnce() {
        List<UUID> dueIds = paymentService.findDuePaymentIds();
        int executed = 0;
        for (UUID paymentId : dueIds) {
            try {
                paymentService.executeScheduledPayment(paymentId, KEEPER_CALLER);
                executed++;
            } catch (SettlementException e) {
                log.warn("Skipped due payment {}: {}", paymentId, e.getMessage());
            } catch (Exception e) {
                log.error("Failed to execute due payment {}: {}", paymentId, e.getMessage(), e);
            }
        }
        return executed;
    }
}
