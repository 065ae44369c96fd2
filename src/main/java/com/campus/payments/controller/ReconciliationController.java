package com.campus.payments.controller;

import com.campus.payments.config.PaymentProperties;
import com.campus.payments.dto.ReconciliationResult;
import com.campus.payments.entity.Transaction;
import com.campus.payments.entity.TransactionStatus;
import com.campus.payments.exception.ResourceNotFoundException;
import com.campus.payments.repository.TransactionRepository;
import com.campus.payments.service.PendingPaymentSweeper;
import com.campus.payments.service.PendingPaymentSweeper.SweepStats;
import com.campus.payments.service.TransactionStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for reconciliation operations.
 * <p>
 * Provides endpoints for:
 * - Triggering a manual sweep of pending payments
 * - Viewing reconciliation statistics
 * - Inspecting transactions (pending, stuck, by reference)
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reconciliation", description = "Pending payment sweep and transaction inspection")
public class ReconciliationController {

    private final PendingPaymentSweeper sweeper;
    private final TransactionStore transactionStore;
    private final TransactionRepository transactionRepository;
    private final PaymentProperties properties;

    @Operation(
            summary = "Trigger a manual sweep",
            description = "Verifies every stale pending payment with its provider. Useful after a provider outage "
                    + "or when webhooks were not delivered."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Sweep completed",
                    content = @Content(schema = @Schema(implementation = ReconciliationResult.class))),
            @ApiResponse(responseCode = "409", description = "Sweep already in progress")
    })
    @PostMapping("/run")
    public ResponseEntity<ReconciliationResult> triggerSweep() {
        log.info("Manual sweep triggered via API");
        return ResponseEntity.ok(sweeper.sweepPendingTransactions());
    }

    @Operation(summary = "Get reconciliation statistics",
            description = "Pending, successful and failed transaction counts and whether a sweep is running.")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = SweepStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<SweepStats> getStats() {
        return ResponseEntity.ok(sweeper.getStats());
    }

    @Operation(summary = "Get pending transactions")
    @ApiResponse(responseCode = "200", description = "Pending transactions retrieved successfully")
    @GetMapping("/transactions/pending")
    public ResponseEntity<Page<Transaction>> getPendingTransactions(
            @Parameter(description = "Page number (0-indexed)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        Page<Transaction> transactions = transactionRepository.findByStatus(
                TransactionStatus.PENDING,
                PageRequest.of(page, size, Sort.by("createdAt"))
        );
        return ResponseEntity.ok(transactions);
    }

    @Operation(
            summary = "Get transactions needing manual review",
            description = "Pending transactions the sweeper has stopped retrying."
    )
    @ApiResponse(responseCode = "200", description = "Transactions needing review retrieved successfully")
    @GetMapping("/transactions/needs-review")
    public ResponseEntity<List<Transaction>> getTransactionsNeedingReview(
            @Parameter(description = "Minimum verification attempts; defaults to the sweep limit")
            @RequestParam(required = false) Integer minAttempts) {

        int threshold = minAttempts != null ? minAttempts : properties.getSweep().getMaxAttempts();
        return ResponseEntity.ok(transactionRepository.findTransactionsNeedingManualReview(
                TransactionStatus.PENDING, threshold));
    }

    @Operation(summary = "Get transaction by provider reference")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Transaction found",
                    content = @Content(schema = @Schema(implementation = Transaction.class))),
            @ApiResponse(responseCode = "404", description = "Transaction not found")
    })
    @GetMapping("/transactions/{reference}")
    public ResponseEntity<Transaction> getTransaction(
            @Parameter(description = "Provider reference") @PathVariable String reference) {
        return transactionStore.findByReference(reference)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction", reference));
    }
}
