package com.campus.payments.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Represents the answer of a gateway's verify API for one charge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderVerification {

    private String providerReference;

    private ProviderStatus status;

    /**
     * When the provider captured the payment. Null unless the status is SUCCESS, and may be
     * null even then (Stripe sessions carry no capture time).
     */
    private OffsetDateTime paidAt;

    /**
     * Smallest currency unit, as confirmed by the provider.
     */
    private Long amount;

    private String currency;

    /**
     * Provider's human readable message, e.g. Paystack's gateway_response ("Approved", "Declined").
     */
    private String gatewayResponse;

    @Builder.Default
    private PaymentMetadata metadata = PaymentMetadata.empty();
}
