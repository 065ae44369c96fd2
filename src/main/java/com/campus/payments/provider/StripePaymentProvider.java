package com.campus.payments.provider;

import com.campus.payments.config.PaymentProperties;
import com.campus.payments.exception.GatewayException;
import com.campus.payments.exception.GatewayRejectedException;
import com.campus.payments.exception.GatewayUnavailableException;
import com.campus.payments.exception.ReferenceNotFoundException;
import com.campus.payments.exception.ValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.checkout.Session;
import com.stripe.net.RequestOptions;
import com.stripe.net.Webhook;
import com.stripe.param.checkout.SessionCreateParams;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Stripe gateway client built on Checkout Sessions. The session id is the provider reference.
 * <p>
 * Uses per-request {@link RequestOptions} carrying the API key and the gateway timeouts; the
 * global {@code Stripe.apiKey} is never set.
 */
@Component
@Slf4j
public class StripePaymentProvider implements PaymentProvider {

    public static final String PROVIDER_ID = "stripe";
    public static final String SIGNATURE_HEADER = "Stripe-Signature";

    static final String SESSION_COMPLETED = "checkout.session.completed";
    static final String ASYNC_PAYMENT_SUCCEEDED = "checkout.session.async_payment_succeeded";
    static final String ASYNC_PAYMENT_FAILED = "checkout.session.async_payment_failed";
    static final String SESSION_EXPIRED = "checkout.session.expired";

    private final PaymentProperties properties;
    private final ChargeEventParser eventParser;

    public StripePaymentProvider(PaymentProperties properties, ChargeEventParser eventParser) {
        this.properties = properties;
        this.eventParser = eventParser;
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    @CircuitBreaker(name = PROVIDER_ID, fallbackMethod = "initiateFallback")
    public ProviderCharge initiate(ChargeRequest request) {
        String successUrl = properties.getCallbackUrl() + "?reference={CHECKOUT_SESSION_ID}";
        String cancelUrl = properties.getCancelUrl() != null ? properties.getCancelUrl() : properties.getCallbackUrl();

        SessionCreateParams params = SessionCreateParams.builder()
                .setMode(SessionCreateParams.Mode.PAYMENT)
                .setClientReferenceId(String.valueOf(request.studentId()))
                .setCustomerEmail(request.payerEmail())
                .setSuccessUrl(successUrl)
                .setCancelUrl(cancelUrl)
                .putMetadata(PaymentMetadata.STUDENT_ID, String.valueOf(request.studentId()))
                .putMetadata(PaymentMetadata.SEMESTER, request.termContext().getSemester())
                .putMetadata(PaymentMetadata.ACADEMIC_YEAR, request.termContext().getAcademicYear())
                .putMetadata(PaymentMetadata.DESCRIPTION, request.description())
                .addLineItem(SessionCreateParams.LineItem.builder()
                        .setQuantity(1L)
                        .setPriceData(SessionCreateParams.LineItem.PriceData.builder()
                                .setCurrency(request.currency().toLowerCase(Locale.ROOT))
                                .setUnitAmount(request.amount())
                                .setProductData(SessionCreateParams.LineItem.PriceData.ProductData.builder()
                                        .setName(request.description())
                                        .build())
                                .build())
                        .build())
                .build();

        try {
            Session session = Session.create(params, requestOptions());
            log.info("Stripe checkout session {} created for student {} ({} {})",
                    session.getId(), request.studentId(), request.amount(), request.currency());
            return new ProviderCharge(session.getId(), session.getUrl(), null);
        } catch (StripeException e) {
            throw translate(e, null, true);
        }
    }

    @Override
    @CircuitBreaker(name = PROVIDER_ID, fallbackMethod = "verifyFallback")
    public ProviderVerification verify(String providerReference) {
        Session session;
        try {
            session = Session.retrieve(providerReference, requestOptions());
        } catch (StripeException e) {
            throw translate(e, providerReference, false);
        }

        ProviderStatus status = mapSessionStatus(session.getStatus(), session.getPaymentStatus());
        return ProviderVerification.builder()
                .providerReference(providerReference)
                .status(status)
                .amount(session.getAmountTotal())
                .currency(ChargeEventParser.upper(session.getCurrency()))
                .gatewayResponse("status=" + session.getStatus() + ", payment_status=" + session.getPaymentStatus())
                .metadata(eventParser.parseMetadata(session.getMetadata()))
                .build();
    }

    public ProviderCharge initiateFallback(ChargeRequest request, CallNotPermittedException e) {
        log.warn("Stripe circuit open, refusing charge initiation for student {}", request.studentId());
        throw new GatewayUnavailableException("Stripe temporarily unavailable", PROVIDER_ID, null, e);
    }

    public ProviderVerification verifyFallback(String providerReference, CallNotPermittedException e) {
        log.warn("Stripe circuit open, cannot verify {}", providerReference);
        throw new GatewayUnavailableException("Stripe temporarily unavailable", PROVIDER_ID, providerReference, e);
    }

    @Override
    public String signatureHeader() {
        return SIGNATURE_HEADER;
    }

    @Override
    public boolean verifySignature(byte[] rawBody, String signatureHeaderValue) {
        String secret = properties.getStripe().getWebhookSecret();
        if (rawBody == null || isBlank(signatureHeaderValue) || isBlank(secret)) {
            return false;
        }
        try {
            return Webhook.Signature.verifyHeader(
                    new String(rawBody, StandardCharsets.UTF_8),
                    signatureHeaderValue,
                    secret,
                    properties.getStripe().getSignatureTolerance().getSeconds());
        } catch (SignatureVerificationException e) {
            log.debug("Stripe signature check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Reads the checkout session out of a Stripe event. Completed sessions whose payment is
     * still being processed (delayed payment methods) are ignored; the async_payment_* event
     * that follows carries the outcome.
     */
    @Override
    public WebhookEvent parseWebhookEvent(byte[] rawBody) {
        JsonNode root = eventParser.readTree(rawBody);
        String eventType = ChargeEventParser.text(root, "type");
        if (eventType == null) {
            throw new ValidationException("Stripe event has no type");
        }

        JsonNode session = root.path("data").path("object");
        WebhookEvent.Type type = switch (eventType) {
            case SESSION_COMPLETED -> isPaid(ChargeEventParser.text(session, "payment_status"))
                    ? WebhookEvent.Type.CHARGE_SUCCESS
                    : WebhookEvent.Type.IGNORED;
            case ASYNC_PAYMENT_SUCCEEDED -> WebhookEvent.Type.CHARGE_SUCCESS;
            case ASYNC_PAYMENT_FAILED, SESSION_EXPIRED -> WebhookEvent.Type.CHARGE_FAILED;
            default -> WebhookEvent.Type.IGNORED;
        };
        if (type == WebhookEvent.Type.IGNORED) {
            return WebhookEvent.ignored(eventType);
        }

        String reference = ChargeEventParser.text(session, "id");
        if (reference == null) {
            throw new ValidationException("Stripe event " + eventType + " carries no session id");
        }

        return new WebhookEvent(
                eventType,
                type,
                reference,
                ChargeEventParser.longValue(session, "amount_total"),
                ChargeEventParser.upper(ChargeEventParser.text(session, "currency")),
                type == WebhookEvent.Type.CHARGE_SUCCESS
                        ? ChargeEventParser.fromEpochSeconds(root.path("created").asLong(0))
                        : null,
                eventParser.parseMetadata(session.get("metadata"))
        );
    }

    static ProviderStatus mapSessionStatus(String sessionStatus, String paymentStatus) {
        if (isPaid(paymentStatus)) {
            return ProviderStatus.SUCCESS;
        }
        if ("expired".equals(sessionStatus)) {
            return ProviderStatus.FAILED;
        }
        return ProviderStatus.PENDING;
    }

    private static boolean isPaid(String paymentStatus) {
        return "paid".equals(paymentStatus) || "no_payment_required".equals(paymentStatus);
    }

    private RequestOptions requestOptions() {
        PaymentProperties.Gateway gateway = properties.getGateway();
        return RequestOptions.builder()
                .setApiKey(properties.getStripe().getApiKey())
                .setConnectTimeout((int) gateway.getConnectTimeout().toMillis())
                .setReadTimeout((int) gateway.getReadTimeout().toMillis())
                .build();
    }

    private GatewayException translate(StripeException e, String providerReference, boolean initiating) {
        Integer statusCode = e.getStatusCode();
        if (e instanceof ApiConnectionException || statusCode == null || statusCode >= 500 || statusCode == 429) {
            return new GatewayUnavailableException("Stripe unavailable: " + e.getMessage(), PROVIDER_ID, providerReference, e);
        }
        if (!initiating && (statusCode == 404 || "resource_missing".equals(e.getCode()))) {
            return new ReferenceNotFoundException(PROVIDER_ID, providerReference, e);
        }
        if (initiating) {
            log.warn("Stripe rejected checkout session creation: {} {}", statusCode, e.getMessage());
            return new GatewayRejectedException("Stripe rejected the charge: " + e.getMessage(), PROVIDER_ID, e);
        }
        return new GatewayUnavailableException("Stripe verify failed: " + e.getMessage(), PROVIDER_ID, providerReference, e);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
