package com.campus.payments.dto;

/**
 * Where to send the payer, plus the identifiers the client needs to confirm the payment later.
 */
public record InitiatePaymentResponse(
        String providerReference,
        String authorizationUrl,
        String accessCode,
        Long internalTransactionId
) {
}
