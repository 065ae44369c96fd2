package com.campus.payments.provider;

/**
 * A charge freshly created at the provider. {@code accessCode} is Paystack-only and null elsewhere.
 */
public record ProviderCharge(String providerReference, String authorizationUrl, String accessCode) {
}
