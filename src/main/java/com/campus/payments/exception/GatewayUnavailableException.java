package com.campus.payments.exception;

/**
 * The provider could not be reached, timed out, answered with a server error, or its
 * circuit breaker is open.
 */
public class GatewayUnavailableException extends GatewayException {

    public GatewayUnavailableException(String message, String providerName) {
        super(message, providerName, null, true, null);
    }

    public GatewayUnavailableException(String message, String providerName, String providerReference,
                                       Throwable cause) {
        super(message, providerName, providerReference, true, cause);
    }
}
