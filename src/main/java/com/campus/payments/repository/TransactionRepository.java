package com.campus.payments.repository;

import com.campus.payments.entity.Transaction;
import com.campus.payments.entity.TransactionStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for payment transactions. The conditional status update is the only
 * write path for status changes.
 */
@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {

    Optional<Transaction> findByProviderReference(String providerReference);

    boolean existsByProviderReference(String providerReference);

    Page<Transaction> findByStatus(TransactionStatus status, Pageable pageable);

    long countByStatus(TransactionStatus status);

    List<Transaction> findByStudentIdAndStatusOrderByPaidAtAsc(Long studentId, TransactionStatus status);

    /**
     * Compare-and-set on the status column: moves the row to {@code newStatus} only if it is
     * still in {@code expectedStatus}. Returns the number of rows changed (0 or 1), so the
     * caller learns in the same statement whether it performed the transition.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Transaction t SET t.status = :newStatus, t.paidAt = :paidAt, t.updatedAt = :now " +
            "WHERE t.providerReference = :providerReference AND t.status = :expectedStatus")
    int compareAndSetStatus(
            @Param("providerReference") String providerReference,
            @Param("expectedStatus") TransactionStatus expectedStatus,
            @Param("newStatus") TransactionStatus newStatus,
            @Param("paidAt") OffsetDateTime paidAt,
            @Param("now") OffsetDateTime now
    );

    /**
     * Bumps the verification counter of a transaction that is still pending.
     * Never touches status, so it cannot race with a terminal transition.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Transaction t SET t.verificationAttempts = COALESCE(t.verificationAttempts, 0) + 1, " +
            "t.lastError = :lastError, t.updatedAt = :now " +
            "WHERE t.providerReference = :providerReference AND t.status = :pendingStatus")
    int recordVerificationAttempt(
            @Param("providerReference") String providerReference,
            @Param("pendingStatus") TransactionStatus pendingStatus,
            @Param("lastError") String lastError,
            @Param("now") OffsetDateTime now
    );

    /**
     * Stale transactions for the sweeper, keyset-paged by id so that rows leaving the
     * status mid-run do not shift later pages.
     */
    @Query("SELECT t FROM Transaction t WHERE t.status = :status " +
            "AND t.createdAt < :createdBefore " +
            "AND (t.verificationAttempts IS NULL OR t.verificationAttempts < :maxAttempts) " +
            "AND t.id > :afterId " +
            "ORDER BY t.id ASC")
    List<Transaction> findSweepCandidates(
            @Param("status") TransactionStatus status,
            @Param("createdBefore") OffsetDateTime createdBefore,
            @Param("maxAttempts") int maxAttempts,
            @Param("afterId") long afterId,
            Pageable pageable
    );

    /**
     * Pending transactions the sweeper has given up on; these need a human.
     */
    @Query("SELECT t FROM Transaction t WHERE t.status = :status " +
            "AND t.verificationAttempts >= :minAttempts ORDER BY t.createdAt ASC")
    List<Transaction> findTransactionsNeedingManualReview(
            @Param("status") TransactionStatus status,
            @Param("minAttempts") int minAttempts
    );
}
