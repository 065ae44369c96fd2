package com.campus.payments.dto;

import com.campus.payments.entity.Transaction;
import com.campus.payments.entity.TransactionStatus;
import com.campus.payments.provider.ProviderStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of asking the provider about one transaction, from the client or the sweeper.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationOutcome {

    /**
     * Stored status after this call.
     */
    private TransactionStatus status;

    /**
     * What the provider reported. Null when the local record was already terminal and the
     * provider was not asked.
     */
    private ProviderStatus providerStatus;

    private String message;

    private Transaction transaction;

    /**
     * True only for the caller that actually moved the transaction out of PENDING.
     */
    @JsonIgnore
    private boolean transitioned;
}
