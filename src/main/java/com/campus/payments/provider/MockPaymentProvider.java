package com.campus.payments.provider;

import com.campus.payments.config.PaymentProperties;
import com.campus.payments.exception.GatewayUnavailableException;
import com.campus.payments.exception.ReferenceNotFoundException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory payment gateway for local runs and integration tests.
 * <p>
 * Simulates realistic provider behavior including:
 * - Charges that stay pending until completed or failed through the control methods below
 * - Intermittent failures and full outages (for testing resilience)
 * - Network latency
 * <p>
 * Webhook bodies are Paystack-shaped and signed with HMAC-SHA256 in {@code x-mock-signature}.
 */
@Component
@ConditionalOnProperty(prefix = "campus.payments.mock", name = "enabled", havingValue = "true")
@Slf4j
public class MockPaymentProvider implements PaymentProvider {

    public static final String PROVIDER_ID = "mock";
    public static final String SIGNATURE_HEADER = "x-mock-signature";

    // Simulated provider-side charge records
    private final Map<String, ProviderVerification> charges = new ConcurrentHashMap<>();

    private final Random random = new Random();

    private final PaymentProperties properties;
    private final HmacSignatureVerifier signatureVerifier;
    private final ChargeEventParser eventParser;

    private volatile boolean simulateOutage = false;

    public MockPaymentProvider(PaymentProperties properties,
                               HmacSignatureVerifier signatureVerifier,
                               ChargeEventParser eventParser) {
        this.properties = properties;
        this.signatureVerifier = signatureVerifier;
        this.eventParser = eventParser;
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    @CircuitBreaker(name = PROVIDER_ID, fallbackMethod = "initiateFallback")
    public ProviderCharge initiate(ChargeRequest request) {
        simulateNetwork(null);

        String reference = "MOCK-" + UUID.randomUUID();
        charges.put(reference, ProviderVerification.builder()
                .providerReference(reference)
                .status(ProviderStatus.PENDING)
                .amount(request.amount())
                .currency(request.currency())
                .gatewayResponse("Awaiting payment")
                .metadata(request.toMetadata())
                .build());

        log.debug("Mock charge {} created for student {}", reference, request.studentId());
        return new ProviderCharge(reference, "http://localhost/mock-checkout/" + reference,
                reference.substring(5, 15));
    }

    @Override
    @CircuitBreaker(name = PROVIDER_ID, fallbackMethod = "verifyFallback")
    public ProviderVerification verify(String providerReference) {
        simulateNetwork(providerReference);

        ProviderVerification charge = charges.get(providerReference);
        if (charge == null) {
            log.warn("Mock provider has no charge with reference {}", providerReference);
            throw new ReferenceNotFoundException(PROVIDER_ID, providerReference, null);
        }
        return charge;
    }

    public ProviderCharge initiateFallback(ChargeRequest request, CallNotPermittedException e) {
        throw new GatewayUnavailableException("Mock provider circuit breaker is open", PROVIDER_ID, null, e);
    }

    public ProviderVerification verifyFallback(String providerReference, CallNotPermittedException e) {
        log.warn("Circuit breaker open for mock provider, reference {}", providerReference);
        throw new GatewayUnavailableException("Mock provider circuit breaker is open", PROVIDER_ID, providerReference, e);
    }

    @Override
    public String signatureHeader() {
        return SIGNATURE_HEADER;
    }

    @Override
    public boolean verifySignature(byte[] rawBody, String signatureHeaderValue) {
        return signatureVerifier.verify(rawBody, signatureHeaderValue,
                properties.getMock().getWebhookSecret(), HmacSignatureVerifier.HMAC_SHA256);
    }

    @Override
    public WebhookEvent parseWebhookEvent(byte[] rawBody) {
        return eventParser.parseChargeEvent(rawBody);
    }

    private void simulateNetwork(String providerReference) {
        int latencyMs = properties.getMock().getLatencyMs();
        if (latencyMs > 0) {
            try {
                Thread.sleep(random.nextInt(latencyMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (simulateOutage) {
            throw new GatewayUnavailableException("Mock provider is currently unavailable", PROVIDER_ID);
        }
        if (random.nextDouble() < properties.getMock().getFailureRate()) {
            throw new GatewayUnavailableException("Simulated network failure while contacting provider",
                    PROVIDER_ID, providerReference, null);
        }
    }

    // Methods for testing/simulation control

    /**
     * Signs a body the way this provider signs its webhooks.
     */
    public String sign(byte[] rawBody) {
        return signatureVerifier.sign(rawBody, properties.getMock().getWebhookSecret(), HmacSignatureVerifier.HMAC_SHA256);
    }

    /**
     * Simulates the payer completing or abandoning checkout.
     */
    public void updateChargeStatus(String reference, ProviderStatus newStatus) {
        charges.computeIfPresent(reference, (ref, existing) -> ProviderVerification.builder()
                .providerReference(ref)
                .status(newStatus)
                .paidAt(newStatus == ProviderStatus.SUCCESS ? OffsetDateTime.now(ZoneOffset.UTC) : null)
                .amount(existing.getAmount())
                .currency(existing.getCurrency())
                .gatewayResponse(gatewayResponseFor(newStatus))
                .metadata(existing.getMetadata())
                .build());
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Mock provider outage simulation set to: {}", outage);
    }

    public void clearMockData() {
        charges.clear();
    }

    private static String gatewayResponseFor(ProviderStatus status) {
        return switch (status) {
            case SUCCESS -> "Approved";
            case FAILED -> "Declined";
            case ABANDONED -> "Abandoned";
            case PENDING -> "Awaiting payment";
        };
    }
}
