package com.campus.payments.provider;

import com.campus.payments.exception.GatewayRejectedException;
import com.campus.payments.exception.GatewayUnavailableException;
import com.campus.payments.exception.ReferenceNotFoundException;
import com.campus.payments.exception.ValidationException;

/**
 * Interface for communicating with an external payment gateway.
 * <p>
 * One implementation per gateway:
 * - PaystackPaymentProvider (REST API, HMAC-SHA512 webhooks)
 * - StripePaymentProvider (Checkout Sessions through the Stripe SDK)
 * - MockPaymentProvider (in-memory, local runs and tests)
 * <p>
 * The reconciliation engine is written once against this interface and never looks at
 * provider-specific payloads.
 */
public interface PaymentProvider {

    /**
     * Stable id stored on each transaction ("paystack", "stripe", "mock").
     */
    String providerId();

    /**
     * Creates a charge at the provider.
     *
     * @throws GatewayUnavailableException on transport failure, timeout, 5xx or an open circuit
     * @throws GatewayRejectedException    if the provider declines the request
     */
    ProviderCharge initiate(ChargeRequest request);

    /**
     * Asks the provider for the current state of a charge. No side effects.
     *
     * @throws ReferenceNotFoundException  if the provider has no record of the reference
     * @throws GatewayUnavailableException on transport failure, timeout, 5xx or an open circuit
     */
    ProviderVerification verify(String providerReference);

    /**
     * Name of the HTTP header carrying the webhook signature.
     */
    String signatureHeader();

    /**
     * Checks the signature against the exact bytes received. Returns false on a missing
     * header or secret, never throws on mismatch.
     */
    boolean verifySignature(byte[] rawBody, String signatureHeaderValue);

    /**
     * Parses a webhook body whose signature has already been verified.
     *
     * @throws ValidationException if the body is not a well-formed event
     */
    WebhookEvent parseWebhookEvent(byte[] rawBody);
}
