package com.campus.payments.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures the results of a pending payment sweep.
 * Used for reporting, monitoring, and the manual trigger endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;

    @Builder.Default
    private int totalProcessed = 0;

    @Builder.Default
    private int updatedToSuccess = 0;

    @Builder.Default
    private int updatedToFailed = 0;

    /**
     * Reached a terminal state through another trigger (webhook, client) during the sweep.
     */
    @Builder.Default
    private int alreadyTerminal = 0;

    @Builder.Default
    private int stillPending = 0;

    @Builder.Default
    private int errors = 0;

    @Builder.Default
    private List<ReconciliationError> errorDetails = new ArrayList<>();

    /**
     * Individual reconciliation error details.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReconciliationError {
        private Long transactionId;
        private String providerReference;
        private String errorMessage;
        private OffsetDateTime occurredAt;
    }

    public void incrementTotalProcessed() {
        this.totalProcessed++;
    }

    public void incrementUpdatedToSuccess() {
        this.updatedToSuccess++;
    }

    public void incrementUpdatedToFailed() {
        this.updatedToFailed++;
    }

    public void incrementAlreadyTerminal() {
        this.alreadyTerminal++;
    }

    public void incrementStillPending() {
        this.stillPending++;
    }

    public void addError(Long transactionId, String providerReference, String errorMessage) {
        this.errors++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(ReconciliationError.builder()
                .transactionId(transactionId)
                .providerReference(providerReference)
                .errorMessage(errorMessage)
                .occurredAt(OffsetDateTime.now(ZoneOffset.UTC))
                .build());
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
