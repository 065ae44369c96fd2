package com.campus.payments.exception;

/**
 * Webhook body did not match its signature header. The message is deliberately generic.
 */
public class SignatureInvalidException extends ReconciliationException {

    private final String providerName;

    public SignatureInvalidException(String providerName) {
        super("Invalid webhook signature");
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
