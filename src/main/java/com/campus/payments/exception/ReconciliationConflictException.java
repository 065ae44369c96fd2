package com.campus.payments.exception;

/**
 * The store reported a state the conditional transition should make impossible, e.g. a
 * record that is still PENDING after the compare-and-set matched no row. Always a bug in the
 * store layer; logged at error level and never swallowed.
 */
public class ReconciliationConflictException extends ReconciliationException {

    private final String providerReference;

    public ReconciliationConflictException(String providerReference, String message) {
        super(message);
        this.providerReference = providerReference;
    }

    public String getProviderReference() {
        return providerReference;
    }
}
