package com.campus.payments.dto;

/**
 * What the engine did with one webhook delivery. The provider always gets the same
 * acknowledgement; this is for logs and tests.
 */
public record WebhookOutcome(String eventType, String reference, Result result) {

    public enum Result {
        TRANSITIONED,
        ALREADY_TERMINAL,
        IGNORED,
        UNRECONCILABLE
    }
}
