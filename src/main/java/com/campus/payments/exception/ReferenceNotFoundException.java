package com.campus.payments.exception;

/**
 * The provider has no record of the given reference.
 */
public class ReferenceNotFoundException extends GatewayException {

    public ReferenceNotFoundException(String providerName, String providerReference, Throwable cause) {
        super("Provider " + providerName + " has no transaction with reference " + providerReference,
                providerName, providerReference, false, cause);
    }
}
