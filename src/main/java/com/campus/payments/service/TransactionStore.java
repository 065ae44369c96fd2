package com.campus.payments.service;

import com.campus.payments.entity.Transaction;
import com.campus.payments.entity.TransactionStatus;
import com.campus.payments.exception.DuplicateReferenceException;
import com.campus.payments.exception.ReconciliationConflictException;
import com.campus.payments.exception.ResourceNotFoundException;
import com.campus.payments.exception.ValidationException;
import com.campus.payments.repository.TransactionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Persistent record of payment attempts, keyed by provider reference.
 * <p>
 * Key Design Decisions:
 * 1. Status changes are a single conditional UPDATE (status = PENDING in the WHERE clause),
 *    so the database decides which of several concurrent triggers performs a transition
 * 2. No surrounding transaction: each repository call commits on its own and nothing is held
 *    open while callers talk to a gateway
 * 3. The unique index on provider_reference settles racing inserts
 */
@Service
@Slf4j
public class TransactionStore {

    private static final int MAX_ERROR_LENGTH = 500;

    private final TransactionRepository transactionRepository;

    public TransactionStore(TransactionRepository transactionRepository) {
        this.transactionRepository = transactionRepository;
    }

    /**
     * Persists a new transaction.
     *
     * @throws DuplicateReferenceException if the provider reference is already stored
     */
    public Transaction create(Transaction transaction) {
        String reference = transaction.getProviderReference();
        if (transactionRepository.existsByProviderReference(reference)) {
            throw new DuplicateReferenceException(reference);
        }
        try {
            Transaction saved = transactionRepository.saveAndFlush(transaction);
            log.debug("Stored {} transaction {} for reference {}", saved.getStatus(), saved.getId(), reference);
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateReferenceException(reference, e);
        }
    }

    public Optional<Transaction> findByReference(String providerReference) {
        return transactionRepository.findByProviderReference(providerReference);
    }

    /**
     * Moves a transaction from PENDING to a terminal status, at most once.
     * <p>
     * - One row updated: this caller performed the transition
     * - Record already terminal: no-op, the stored record is returned unchanged
     * - No record and reconstruction details given: inserted directly in the terminal status
     * - No record and no details: {@link ResourceNotFoundException}
     * - Details the database refuses for a reason other than a concurrent insert:
     *   {@link ValidationException}
     *
     * @param paidAt provider capture time; defaults to now for SUCCESS, always null for FAILED
     */
    public TransitionResult transitionToTerminal(String providerReference,
                                                 TransactionStatus newStatus,
                                                 OffsetDateTime paidAt,
                                                 ReconstructionDetails reconstruction) {
        if (!newStatus.isTerminal()) {
            throw new IllegalArgumentException("Target status must be terminal, got " + newStatus);
        }
        OffsetDateTime effectivePaidAt = newStatus == TransactionStatus.SUCCESS
                ? (paidAt != null ? paidAt : OffsetDateTime.now(ZoneOffset.UTC))
                : null;

        if (compareAndSet(providerReference, newStatus, effectivePaidAt)) {
            return transitioned(providerReference);
        }

        Optional<Transaction> existing = transactionRepository.findByProviderReference(providerReference);
        if (existing.isPresent()) {
            return resolveExisting(existing.get(), newStatus, effectivePaidAt);
        }

        if (reconstruction == null) {
            throw new ResourceNotFoundException("Transaction", providerReference);
        }
        return insertTerminal(providerReference, newStatus, effectivePaidAt, reconstruction);
    }

    /**
     * Sweeper bookkeeping. Only touches records that are still PENDING.
     */
    public void recordVerificationAttempt(String providerReference, String error) {
        String truncated = error != null && error.length() > MAX_ERROR_LENGTH
                ? error.substring(0, MAX_ERROR_LENGTH)
                : error;
        transactionRepository.recordVerificationAttempt(providerReference, TransactionStatus.PENDING,
                truncated, OffsetDateTime.now(ZoneOffset.UTC));
    }

    private TransitionResult insertTerminal(String providerReference, TransactionStatus newStatus,
                                            OffsetDateTime paidAt, ReconstructionDetails reconstruction) {
        try {
            Transaction inserted = transactionRepository.saveAndFlush(
                    reconstruction.toTransaction(providerReference, newStatus, paidAt));
            log.info("Reconstructed {} transaction {} for unknown reference {} (student {})",
                    newStatus, inserted.getId(), providerReference, reconstruction.studentId());
            return new TransitionResult(inserted, true);
        } catch (DataIntegrityViolationException e) {
            Optional<Transaction> winner = transactionRepository.findByProviderReference(providerReference);
            if (winner.isEmpty()) {
                log.warn("Database refused reconstructed transaction for {}: {}",
                        providerReference, e.getMostSpecificCause().getMessage());
                throw new ValidationException("Cannot store reconstructed transaction " + providerReference, e);
            }
            log.info("Concurrent insert for reference {}, resolving to the stored record", providerReference);
            return resolveExisting(winner.get(), newStatus, paidAt);
        }
    }

    /**
     * A PENDING record here means an initiation committed between our conditional update and
     * the read that followed; the update is attempted once more.
     */
    private TransitionResult resolveExisting(Transaction existing, TransactionStatus newStatus, OffsetDateTime paidAt) {
        String reference = existing.getProviderReference();
        if (existing.isTerminal()) {
            log.debug("Transaction {} already {}, ignoring {} trigger", reference, existing.getStatus(), newStatus);
            return new TransitionResult(existing, false);
        }

        if (compareAndSet(reference, newStatus, paidAt)) {
            return transitioned(reference);
        }

        Transaction reread = transactionRepository.findByProviderReference(reference).orElse(existing);
        if (reread.isTerminal()) {
            return new TransitionResult(reread, false);
        }
        log.error("Transaction {} is still PENDING after a conditional update matched no row", reference);
        throw new ReconciliationConflictException(reference,
                "Transaction " + reference + " could not be moved out of PENDING");
    }

    private boolean compareAndSet(String providerReference, TransactionStatus newStatus, OffsetDateTime paidAt) {
        int updated = transactionRepository.compareAndSetStatus(providerReference, TransactionStatus.PENDING,
                newStatus, paidAt, OffsetDateTime.now(ZoneOffset.UTC));
        return updated == 1;
    }

    private TransitionResult transitioned(String providerReference) {
        Transaction updated = transactionRepository.findByProviderReference(providerReference)
                .orElseThrow(() -> new ReconciliationConflictException(providerReference,
                        "Transaction " + providerReference + " vanished after its status update"));
        log.info("Transaction {} moved PENDING -> {}", providerReference, updated.getStatus());
        return new TransitionResult(updated, true);
    }
}
