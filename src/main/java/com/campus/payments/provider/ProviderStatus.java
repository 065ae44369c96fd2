package com.campus.payments.provider;

/**
 * Charge status as reported by a gateway, normalised across providers.
 */
public enum ProviderStatus {
    /**
     * Payment captured (maps to SUCCESS)
     */
    SUCCESS,

    /**
     * Payment declined or session expired (maps to FAILED)
     */
    FAILED,

    /**
     * Payer left the checkout page. The charge can still be completed, so no change.
     */
    ABANDONED,

    /**
     * Ongoing, queued or processing (keep as PENDING)
     */
    PENDING
}
