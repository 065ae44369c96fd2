package com.campus.payments.scheduler;

import com.campus.payments.dto.ReconciliationResult;
import com.campus.payments.exception.SweepAlreadyRunningException;
import com.campus.payments.service.PendingPaymentSweeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the pending payment sweep on a fixed delay.
 * <p>
 * fixedDelay means the next run is scheduled only once the previous one has returned. The
 * interval should stay well above the provider's webhook retry window, since most pending
 * payments are settled by the webhook long before the sweep sees them.
 * <p>
 * Default: Every 5 minutes
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PendingPaymentSweepScheduler {

    private final PendingPaymentSweeper sweeper;

    @Value("${campus.payments.sweep.enabled:true}")
    private boolean schedulerEnabled;

    @Scheduled(fixedDelayString = "${campus.payments.sweep.interval-ms:300000}",
            initialDelayString = "${campus.payments.sweep.initial-delay-ms:60000}")
    public void runScheduledSweep() {
        if (!schedulerEnabled) {
            log.debug("Sweep scheduler is disabled, skipping run");
            return;
        }

        try {
            ReconciliationResult result = sweeper.sweepPendingTransactions();
            logResult(result);

            if (result.getErrors() > result.getTotalProcessed() * 0.1) {
                log.warn("High error rate in pending payment sweep: {} errors out of {} processed",
                        result.getErrors(), result.getTotalProcessed());
            }
        } catch (SweepAlreadyRunningException e) {
            log.warn("Sweep skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled sweep failed with unexpected error", e);
        }
    }

    private void logResult(ReconciliationResult result) {
        if (result.getTotalProcessed() == 0) {
            log.info("No stale pending payments to sweep");
        } else {
            log.info("Sweep completed in {}ms: {} processed, {} succeeded, {} failed, {} errors",
                    result.getDurationMs(),
                    result.getTotalProcessed(),
                    result.getUpdatedToSuccess(),
                    result.getUpdatedToFailed(),
                    result.getErrors());
        }
    }
}
