package com.campus.payments.provider;

import java.time.OffsetDateTime;

/**
 * A parsed and already signature-checked webhook delivery.
 */
public record WebhookEvent(
        String eventType,
        Type type,
        String reference,
        Long amount,
        String currency,
        OffsetDateTime paidAt,
        PaymentMetadata metadata
) {

    public enum Type {
        CHARGE_SUCCESS,
        CHARGE_FAILED,
        IGNORED
    }

    public static WebhookEvent ignored(String eventType) {
        return new WebhookEvent(eventType, Type.IGNORED, null, null, null, null, PaymentMetadata.empty());
    }
}
