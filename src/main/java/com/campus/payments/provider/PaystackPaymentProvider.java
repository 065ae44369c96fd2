package com.campus.payments.provider;

import com.campus.payments.config.PaymentProperties;
import com.campus.payments.exception.GatewayRejectedException;
import com.campus.payments.exception.GatewayUnavailableException;
import com.campus.payments.exception.ReferenceNotFoundException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Paystack gateway client.
 * <p>
 * - Initiate: POST /transaction/initialize
 * - Verify: GET /transaction/verify/{reference}
 * - Webhooks: hex HMAC-SHA512 of the raw body in x-paystack-signature, keyed with the secret key
 * <p>
 * Calls are bounded by the gateway timeouts applied to the injected RestClient.Builder and run
 * behind the "paystack" circuit breaker. Nothing is retried here; the browser, the provider's
 * own webhook redelivery and the sweeper are the retry mechanisms.
 */
@Component
@Slf4j
public class PaystackPaymentProvider implements PaymentProvider {

    public static final String PROVIDER_ID = "paystack";
    public static final String SIGNATURE_HEADER = "x-paystack-signature";

    private final RestClient restClient;
    private final PaymentProperties properties;
    private final HmacSignatureVerifier signatureVerifier;
    private final ChargeEventParser eventParser;

    public PaystackPaymentProvider(RestClient.Builder restClientBuilder,
                                   PaymentProperties properties,
                                   HmacSignatureVerifier signatureVerifier,
                                   ChargeEventParser eventParser) {
        this.properties = properties;
        this.signatureVerifier = signatureVerifier;
        this.eventParser = eventParser;
        this.restClient = restClientBuilder
                .baseUrl(properties.getPaystack().getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getPaystack().getSecretKey())
                .build();
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    @CircuitBreaker(name = PROVIDER_ID, fallbackMethod = "initiateFallback")
    public ProviderCharge initiate(ChargeRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(PaymentMetadata.STUDENT_ID, request.studentId());
        metadata.put(PaymentMetadata.SEMESTER, request.termContext().getSemester());
        metadata.put(PaymentMetadata.ACADEMIC_YEAR, request.termContext().getAcademicYear());
        metadata.put(PaymentMetadata.DESCRIPTION, request.description());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", request.payerEmail());
        body.put("amount", request.amount());
        body.put("currency", request.currency());
        body.put("metadata", metadata);
        if (properties.getCallbackUrl() != null) {
            body.put("callback_url", properties.getCallbackUrl());
        }

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/transaction/initialize")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (HttpClientErrorException e) {
            log.warn("Paystack rejected charge initiation for student {}: {} {}",
                    request.studentId(), e.getStatusCode(), e.getResponseBodyAsString());
            throw new GatewayRejectedException("Paystack rejected the charge with " + e.getStatusCode(), PROVIDER_ID, e);
        } catch (HttpServerErrorException e) {
            throw new GatewayUnavailableException("Paystack returned " + e.getStatusCode(), PROVIDER_ID, null, e);
        } catch (RestClientException e) {
            throw new GatewayUnavailableException("Paystack unreachable: " + e.getMessage(), PROVIDER_ID, null, e);
        }

        if (response == null || !response.path("status").asBoolean(false)) {
            String message = response == null ? "empty response" : ChargeEventParser.text(response, "message");
            throw new GatewayRejectedException("Paystack declined the charge: " + message, PROVIDER_ID);
        }

        JsonNode data = response.path("data");
        String reference = ChargeEventParser.text(data, "reference");
        if (reference == null) {
            throw new GatewayUnavailableException("Paystack response carried no reference", PROVIDER_ID);
        }

        log.info("Paystack charge {} created for student {} ({} {})",
                reference, request.studentId(), request.amount(), request.currency());

        return new ProviderCharge(
                reference,
                ChargeEventParser.text(data, "authorization_url"),
                ChargeEventParser.text(data, "access_code"));
    }

    @Override
    @CircuitBreaker(name = PROVIDER_ID, fallbackMethod = "verifyFallback")
    public ProviderVerification verify(String providerReference) {
        JsonNode response;
        try {
            response = restClient.get()
                    .uri("/transaction/verify/{reference}", providerReference)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND) || e.getStatusCode().isSameCodeAs(HttpStatus.BAD_REQUEST)) {
                throw new ReferenceNotFoundException(PROVIDER_ID, providerReference, e);
            }
            throw new GatewayUnavailableException("Paystack verify returned " + e.getStatusCode(),
                    PROVIDER_ID, providerReference, e);
        } catch (HttpServerErrorException e) {
            throw new GatewayUnavailableException("Paystack verify returned " + e.getStatusCode(),
                    PROVIDER_ID, providerReference, e);
        } catch (ResourceAccessException e) {
            throw new GatewayUnavailableException("Paystack unreachable: " + e.getMessage(),
                    PROVIDER_ID, providerReference, e);
        } catch (RestClientException e) {
            throw new GatewayUnavailableException("Paystack verify failed: " + e.getMessage(),
                    PROVIDER_ID, providerReference, e);
        }

        if (response == null || !response.path("status").asBoolean(false) || !response.path("data").isObject()) {
            throw new ReferenceNotFoundException(PROVIDER_ID, providerReference, null);
        }

        ProviderVerification verification = eventParser.toVerification(providerReference, response.path("data"));
        log.debug("Paystack reports {} for {} ({})",
                verification.getStatus(), providerReference, verification.getGatewayResponse());
        return verification;
    }

    /**
     * Fallback when the circuit is open. Other failures propagate untouched.
     */
    public ProviderCharge initiateFallback(ChargeRequest request, CallNotPermittedException e) {
        log.warn("Paystack circuit open, refusing charge initiation for student {}", request.studentId());
        throw new GatewayUnavailableException("Paystack temporarily unavailable", PROVIDER_ID, null, e);
    }

    public ProviderVerification verifyFallback(String providerReference, CallNotPermittedException e) {
        log.warn("Paystack circuit open, cannot verify {}", providerReference);
        throw new GatewayUnavailableException("Paystack temporarily unavailable", PROVIDER_ID, providerReference, e);
    }

    @Override
    public String signatureHeader() {
        return SIGNATURE_HEADER;
    }

    @Override
    public boolean verifySignature(byte[] rawBody, String signatureHeaderValue) {
        return signatureVerifier.verify(rawBody, signatureHeaderValue,
                properties.getPaystack().getSecretKey(), HmacSignatureVerifier.HMAC_SHA512);
    }

    @Override
    public WebhookEvent parseWebhookEvent(byte[] rawBody) {
        return eventParser.parseChargeEvent(rawBody);
    }
}
