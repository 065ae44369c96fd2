package com.campus.payments.exception;

/**
 * Thrown when a call to a payment provider does not produce a usable answer.
 * Carries the provider and reference involved so callers can log and surface them.
 */
public abstract class GatewayException extends ReconciliationException {

    private final String providerName;
    private final String providerReference;
    private final boolean retryable;

    protected GatewayException(String message, String providerName, String providerReference,
                               boolean retryable, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
        this.providerReference = providerReference;
        this.retryable = retryable;
    }

    public String getProviderName() {
        return providerName;
    }

    public String getProviderReference() {
        return providerReference;
    }

    /**
     * Indicates if this error is transient and the caller (browser or provider redelivery)
     * may try again. Non-retryable errors include declined charges and unknown references.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
