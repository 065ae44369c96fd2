package com.campus.payments.service;

import com.campus.payments.entity.TermContext;
import com.campus.payments.entity.Transaction;
import com.campus.payments.entity.TransactionStatus;
import com.campus.payments.provider.PaymentMetadata;
import com.campus.payments.provider.WebhookEvent;

import java.time.OffsetDateTime;

/**
 * What is needed to insert a transaction the store has never seen, taken from a verified
 * webhook's metadata.
 */
public record ReconstructionDetails(
        Long studentId,
        String providerName,
        Long amount,
        String currency,
        TermContext termContext,
        String description
) {

    // Column sizes of the transactions table
    static final int MAX_CURRENCY_LENGTH = 3;
    static final int MAX_ACADEMIC_YEAR_LENGTH = 20;
    static final int MAX_SEMESTER_LENGTH = 30;
    static final int MAX_DESCRIPTION_LENGTH = 255;

    /**
     * @return details for the event, or null when its metadata or amount is not enough to
     * rebuild a transaction, or does not fit the stored columns
     */
    public static ReconstructionDetails fromEvent(String providerName, WebhookEvent event) {
        PaymentMetadata metadata = event.metadata();
        if (metadata == null || !metadata.isComplete() || event.amount() == null || event.currency() == null) {
            return null;
        }
        if (event.currency().length() > MAX_CURRENCY_LENGTH
                || metadata.academicYear().length() > MAX_ACADEMIC_YEAR_LENGTH
                || metadata.semester().length() > MAX_SEMESTER_LENGTH) {
            return null;
        }
        TermContext termContext = metadata.termContext();
        String description = metadata.description() != null
                ? metadata.description()
                : PaymentInitiationService.defaultDescription(termContext);
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            description = description.substring(0, MAX_DESCRIPTION_LENGTH);
        }
        return new ReconstructionDetails(metadata.studentId(), providerName, event.amount(), event.currency(),
                termContext, description);
    }

    Transaction toTransaction(String providerReference, TransactionStatus status, OffsetDateTime paidAt) {
        return Transaction.builder()
                .studentId(studentId)
                .providerReference(providerReference)
                .providerName(providerName)
                .amount(amount)
                .currency(currency)
                .status(status)
                .termContext(termContext)
                .description(description)
                .paidAt(paidAt)
                .build();
    }
}
