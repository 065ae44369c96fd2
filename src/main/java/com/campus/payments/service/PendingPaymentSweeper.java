package com.campus.payments.service;

import com.campus.payments.config.PaymentProperties;
import com.campus.payments.dto.ReconciliationResult;
import com.campus.payments.dto.VerificationOutcome;
import com.campus.payments.entity.Transaction;
import com.campus.payments.entity.TransactionStatus;
import com.campus.payments.exception.GatewayException;
import com.campus.payments.exception.SweepAlreadyRunningException;
import com.campus.payments.repository.TransactionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Server-to-provider verification of PENDING transactions nobody has confirmed.
 * <p>
 * Covers webhooks the provider never delivered and payers who never came back to the
 * confirmation page. Key points:
 * 1. Keyset pagination by id: rows that leave PENDING mid-run do not shift later batches
 * 2. Resilience: a failure on one transaction is recorded and the batch continues
 * 3. Bounded: a transaction is retried at most max-attempts times, then left for manual review
 * 4. One run at a time
 */
@Service
@Slf4j
public class PendingPaymentSweeper {

    private static final int MAX_BATCHES = 10000;

    private final TransactionRepository transactionRepository;
    private final TransactionStore transactionStore;
    private final ReconciliationEngine reconciliationEngine;
    private final PaymentProperties properties;
    private final MeterRegistry meterRegistry;

    // Metrics
    private Counter sweptCounter;
    private Counter sweepErrorCounter;
    private Timer sweepTimer;

    // Prevents concurrent sweeps
    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public PendingPaymentSweeper(TransactionRepository transactionRepository,
                                 TransactionStore transactionStore,
                                 ReconciliationEngine reconciliationEngine,
                                 PaymentProperties properties,
                                 MeterRegistry meterRegistry) {
        this.transactionRepository = transactionRepository;
        this.transactionStore = transactionStore;
        this.reconciliationEngine = reconciliationEngine;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        sweptCounter = Counter.builder("payments.sweep.transactions")
                .description("Pending transactions verified by the sweeper")
                .register(meterRegistry);

        sweepErrorCounter = Counter.builder("payments.sweep.errors")
                .description("Sweeper verifications that failed")
                .register(meterRegistry);

        sweepTimer = Timer.builder("payments.sweep.duration")
                .description("Time taken to complete a sweep")
                .register(meterRegistry);
    }

    /**
     * Verifies every stale PENDING transaction with its provider.
     *
     * @throws SweepAlreadyRunningException if another sweep is in progress
     */
    public ReconciliationResult sweepPendingTransactions() {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Pending payment sweep already in progress, skipping this run");
            throw new SweepAlreadyRunningException();
        }

        ReconciliationResult result = ReconciliationResult.builder()
                .startedAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build();

        log.info("Starting sweep of pending payments");

        try {
            return sweepTimer.record(() -> {
                processAllStaleTransactions(result);
                result.setCompletedAt(OffsetDateTime.now(ZoneOffset.UTC));

                log.info("Sweep completed. Processed: {}, Updated to SUCCESS: {}, Updated to FAILED: {}, "
                                + "Already terminal: {}, Still pending: {}, Errors: {}",
                        result.getTotalProcessed(),
                        result.getUpdatedToSuccess(),
                        result.getUpdatedToFailed(),
                        result.getAlreadyTerminal(),
                        result.getStillPending(),
                        result.getErrors());

                return result;
            });
        } finally {
            isRunning.set(false);
        }
    }

    private void processAllStaleTransactions(ReconciliationResult result) {
        PaymentProperties.Sweep sweep = properties.getSweep();
        OffsetDateTime createdBefore = OffsetDateTime.now(ZoneOffset.UTC).minus(sweep.getStaleThreshold());
        long afterId = 0L;
        int batches = 0;

        List<Transaction> batch;
        do {
            batch = transactionRepository.findSweepCandidates(
                    TransactionStatus.PENDING,
                    createdBefore,
                    sweep.getMaxAttempts(),
                    afterId,
                    PageRequest.of(0, sweep.getBatchSize()));

            log.debug("Sweeping batch {} with {} transactions", batches, batch.size());

            for (Transaction transaction : batch) {
                processTransaction(transaction, result);
                afterId = transaction.getId();
            }

            // Safety check: prevent infinite loops
            if (++batches >= MAX_BATCHES) {
                log.warn("Reached maximum batch limit ({}), stopping sweep", MAX_BATCHES);
                break;
            }
        } while (batch.size() == sweep.getBatchSize());
    }

    /**
     * Handles all error cases so that the rest of the batch is still processed.
     */
    private void processTransaction(Transaction transaction, ReconciliationResult result) {
        result.incrementTotalProcessed();
        sweptCounter.increment();

        try {
            VerificationOutcome outcome = reconciliationEngine.reconcileWithProvider(
                    transaction, ReconciliationTrigger.SWEEP);

            if (outcome.getStatus() == TransactionStatus.PENDING) {
                result.incrementStillPending();
                transactionStore.recordVerificationAttempt(transaction.getProviderReference(),
                        "Provider status " + outcome.getProviderStatus());
            } else if (!outcome.isTransitioned()) {
                result.incrementAlreadyTerminal();
            } else if (outcome.getStatus() == TransactionStatus.SUCCESS) {
                result.incrementUpdatedToSuccess();
            } else {
                result.incrementUpdatedToFailed();
            }

        } catch (GatewayException e) {
            handleError(transaction, result, e.getMessage());
            log.warn("Provider error sweeping transaction {}: {}", transaction.getId(), e.getMessage());
        } catch (Exception e) {
            handleError(transaction, result, "Unexpected error: " + e.getMessage());
            log.error("Unexpected error sweeping transaction {}: {}", transaction.getId(), e.getMessage(), e);
        }
    }

    private void handleError(Transaction transaction, ReconciliationResult result, String message) {
        sweepErrorCounter.increment();
        result.addError(transaction.getId(), transaction.getProviderReference(), message);
        try {
            transactionStore.recordVerificationAttempt(transaction.getProviderReference(), message);
        } catch (Exception saveError) {
            log.error("Failed to save error state for transaction {}", transaction.getId(), saveError);
        }
    }

    /**
     * Current counts for monitoring dashboards.
     */
    public SweepStats getStats() {
        return SweepStats.builder()
                .pendingCount(transactionRepository.countByStatus(TransactionStatus.PENDING))
                .successCount(transactionRepository.countByStatus(TransactionStatus.SUCCESS))
                .failedCount(transactionRepository.countByStatus(TransactionStatus.FAILED))
                .sweepRunning(isRunning.get())
                .build();
    }

    @Data
    @Builder
    public static class SweepStats {
        private long pendingCount;
        private long successCount;
        private long failedCount;
        private boolean sweepRunning;
    }
}
