package com.campus.payments.exception;

/**
 * Malformed or incomplete input that will never succeed on retry.
 */
public class ValidationException extends ReconciliationException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
