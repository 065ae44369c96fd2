package com.campus.payments.exception;

/**
 * The provider declined the request (invalid amount, bad email, unsupported currency...).
 */
public class GatewayRejectedException extends GatewayException {

    public GatewayRejectedException(String message, String providerName) {
        super(message, providerName, null, false, null);
    }

    public GatewayRejectedException(String message, String providerName, Throwable cause) {
        super(message, providerName, null, false, cause);
    }
}
