package com.campus.payments.exception;

public class DuplicateReferenceException extends ReconciliationException {

    private final String providerReference;

    public DuplicateReferenceException(String providerReference) {
        this(providerReference, null);
    }

    public DuplicateReferenceException(String providerReference, Throwable cause) {
        super("A transaction with reference " + providerReference + " already exists", cause);
        this.providerReference = providerReference;
    }

    public String getProviderReference() {
        return providerReference;
    }
}
