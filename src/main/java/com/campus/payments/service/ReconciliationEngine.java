package com.campus.payments.service;

import com.campus.payments.dto.VerificationOutcome;
import com.campus.payments.dto.WebhookOutcome;
import com.campus.payments.entity.Transaction;
import com.campus.payments.entity.TransactionStatus;
import com.campus.payments.exception.ResourceNotFoundException;
import com.campus.payments.exception.SignatureInvalidException;
import com.campus.payments.exception.ValidationException;
import com.campus.payments.provider.PaymentProvider;
import com.campus.payments.provider.PaymentProviderRegistry;
import com.campus.payments.provider.ProviderVerification;
import com.campus.payments.provider.WebhookEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Objects;

/**
 * The payment state machine: PENDING -> SUCCESS, PENDING -> FAILED, nothing out of a
 * terminal state.
 * <p>
 * Three triggers feed it, in any order and concurrently:
 * - the client confirming after checkout ({@link #confirmFromClient})
 * - the provider's signed webhook ({@link #handleWebhook})
 * - the pending payment sweeper ({@link #reconcileWithProvider})
 * <p>
 * Whichever trigger reaches the store first performs the transition and applies the student
 * projection; every later trigger is a no-op. Client confirmation never trusts caller input:
 * status always comes from a server-to-provider verify call, and only the signature-checked
 * webhook path may create a record the store has not seen.
 */
@Service
@Slf4j
public class ReconciliationEngine {

    private final TransactionStore transactionStore;
    private final PaymentProviderRegistry providerRegistry;
    private final StudentPaymentProjectionService projectionService;
    private final MeterRegistry meterRegistry;

    // Metrics
    private Counter duplicateTriggerCounter;
    private Counter rejectedWebhookCounter;
    private Counter unreconcilableWebhookCounter;
    private Counter projectionFailureCounter;

    public ReconciliationEngine(TransactionStore transactionStore,
                                PaymentProviderRegistry providerRegistry,
                                StudentPaymentProjectionService projectionService,
                                MeterRegistry meterRegistry) {
        this.transactionStore = transactionStore;
        this.providerRegistry = providerRegistry;
        this.projectionService = projectionService;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        duplicateTriggerCounter = Counter.builder("payments.duplicate.triggers")
                .description("Terminal triggers that found the transaction already terminal")
                .register(meterRegistry);

        rejectedWebhookCounter = Counter.builder("payments.webhooks.rejected")
                .description("Webhook deliveries rejected for an invalid signature")
                .register(meterRegistry);

        unreconcilableWebhookCounter = Counter.builder("payments.webhooks.unreconcilable")
                .description("Webhooks for unknown references without usable metadata")
                .register(meterRegistry);

        projectionFailureCounter = Counter.builder("payments.projection.failures")
                .description("Successful transactions whose student projection update failed")
                .register(meterRegistry);
    }

    /**
     * Client-side confirmation after checkout. Requires a local record; a terminal record is
     * returned as is without calling the provider.
     *
     * @param caller authenticated subject asking for the confirmation, for the audit log
     * @throws ResourceNotFoundException if no transaction has this reference
     */
    public VerificationOutcome confirmFromClient(String providerReference, String caller) {
        log.info("Client confirmation of {} requested by {}", providerReference, caller);
        Transaction transaction = transactionStore.findByReference(providerReference)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction", providerReference));

        if (transaction.isTerminal()) {
            duplicateTriggerCounter.increment();
            log.debug("Client confirmation for {} which is already {}", providerReference, transaction.getStatus());
            return VerificationOutcome.builder()
                    .status(transaction.getStatus())
                    .message("Payment already " + transaction.getStatus().name().toLowerCase(Locale.ROOT))
                    .transaction(transaction)
                    .transitioned(false)
                    .build();
        }

        return reconcileWithProvider(transaction, ReconciliationTrigger.CLIENT);
    }

    /**
     * Verifies a stored transaction with the provider that issued its reference and applies a
     * terminal answer. PENDING and ABANDONED answers leave the record untouched.
     */
    public VerificationOutcome reconcileWithProvider(Transaction transaction, ReconciliationTrigger trigger) {
        String reference = transaction.getProviderReference();
        PaymentProvider provider = providerRegistry.resolve(transaction.getProviderName());

        log.debug("Verifying {} with {} ({} trigger)", reference, provider.providerId(), trigger.tag());
        ProviderVerification verification = provider.verify(reference);
        checkAmounts(transaction, verification.getAmount(), verification.getCurrency());

        TransitionResult result = switch (verification.getStatus()) {
            case SUCCESS -> applyTransition(reference, TransactionStatus.SUCCESS, verification, trigger);
            case FAILED -> applyTransition(reference, TransactionStatus.FAILED, verification, trigger);
            case PENDING, ABANDONED -> null;
        };

        if (result == null) {
            log.debug("Provider reports {} for {}, no change", verification.getStatus(), reference);
            return VerificationOutcome.builder()
                    .status(transaction.getStatus())
                    .providerStatus(verification.getStatus())
                    .message(verification.getGatewayResponse())
                    .transaction(transaction)
                    .transitioned(false)
                    .build();
        }

        return VerificationOutcome.builder()
                .status(result.transaction().getStatus())
                .providerStatus(verification.getStatus())
                .message(verification.getGatewayResponse())
                .transaction(result.transaction())
                .transitioned(result.transitioned())
                .build();
    }

    /**
     * Processes one webhook delivery. Signature first, then parsing, then the transition.
     *
     * @param providerId provider named by the route, or null for the active provider
     * @throws SignatureInvalidException if the signature header does not match the raw body
     */
    public WebhookOutcome handleWebhook(String providerId, byte[] rawBody, HttpHeaders headers) {
        PaymentProvider provider = providerId == null ? providerRegistry.active() : providerRegistry.resolve(providerId);

        if (!provider.verifySignature(rawBody, headers.getFirst(provider.signatureHeader()))) {
            rejectedWebhookCounter.increment();
            log.warn("Rejected {} webhook with invalid or missing signature", provider.providerId());
            throw new SignatureInvalidException(provider.providerId());
        }

        WebhookEvent event = provider.parseWebhookEvent(rawBody);
        if (event.type() == WebhookEvent.Type.IGNORED) {
            log.debug("Ignoring {} webhook event {}", provider.providerId(), event.eventType());
            return new WebhookOutcome(event.eventType(), null, WebhookOutcome.Result.IGNORED);
        }

        TransactionStatus target = event.type() == WebhookEvent.Type.CHARGE_SUCCESS
                ? TransactionStatus.SUCCESS
                : TransactionStatus.FAILED;
        ReconstructionDetails reconstruction = ReconstructionDetails.fromEvent(provider.providerId(), event);

        TransitionResult result;
        try {
            result = applyTransition(event.reference(), target, event.paidAt(), reconstruction,
                    ReconciliationTrigger.WEBHOOK);
        } catch (ResourceNotFoundException e) {
            unreconcilableWebhookCounter.increment();
            log.error("Cannot reconcile {} event for unknown reference {}: no usable metadata",
                    event.eventType(), event.reference());
            return new WebhookOutcome(event.eventType(), event.reference(), WebhookOutcome.Result.UNRECONCILABLE);
        } catch (ValidationException e) {
            unreconcilableWebhookCounter.increment();
            log.error("Cannot reconcile {} event for unknown reference {}: {}",
                    event.eventType(), event.reference(), e.getMessage());
            return new WebhookOutcome(event.eventType(), event.reference(), WebhookOutcome.Result.UNRECONCILABLE);
        }

        checkAmounts(result.transaction(), event.amount(), event.currency());
        return new WebhookOutcome(event.eventType(), event.reference(),
                result.transitioned() ? WebhookOutcome.Result.TRANSITIONED : WebhookOutcome.Result.ALREADY_TERMINAL);
    }

    private TransitionResult applyTransition(String reference, TransactionStatus target,
                                             ProviderVerification verification, ReconciliationTrigger trigger) {
        return applyTransition(reference, target, verification.getPaidAt(), null, trigger);
    }

    private TransitionResult applyTransition(String reference, TransactionStatus target,
                                             OffsetDateTime paidAt,
                                             ReconstructionDetails reconstruction,
                                             ReconciliationTrigger trigger) {
        TransitionResult result = transactionStore.transitionToTerminal(reference, target, paidAt, reconstruction);

        if (!result.transitioned()) {
            duplicateTriggerCounter.increment();
            log.debug("{} trigger for {} found it already {}", trigger.tag(), reference,
                    result.transaction().getStatus());
            return result;
        }

        meterRegistry.counter("payments.transitions",
                "status", target.name().toLowerCase(Locale.ROOT),
                "trigger", trigger.tag()).increment();
        log.info("Payment {} reconciled to {} via {}", reference, target, trigger.tag());

        if (target == TransactionStatus.SUCCESS) {
            applyProjection(result.transaction());
        }
        return result;
    }

    /**
     * The transaction is already SUCCESS at this point and stays so. A failure here leaves the
     * student record behind; it is counted and can be repaired with a projection rebuild.
     */
    private void applyProjection(Transaction transaction) {
        try {
            projectionService.applySuccessfulPayment(transaction);
        } catch (RuntimeException e) {
            projectionFailureCounter.increment();
            log.error("Transaction {} is SUCCESS but the payment status of student {} could not be updated; "
                            + "rebuild the projection for this student",
                    transaction.getProviderReference(), transaction.getStudentId(), e);
        }
    }

    private void checkAmounts(Transaction transaction, Long reportedAmount, String reportedCurrency) {
        if (reportedAmount != null && !Objects.equals(reportedAmount, transaction.getAmount())) {
            log.warn("Amount mismatch for {}: stored {} {}, provider reports {} {}",
                    transaction.getProviderReference(), transaction.getAmount(), transaction.getCurrency(),
                    reportedAmount, reportedCurrency);
        } else if (reportedCurrency != null && !reportedCurrency.equalsIgnoreCase(transaction.getCurrency())) {
            log.warn("Currency mismatch for {}: stored {}, provider reports {}",
                    transaction.getProviderReference(), transaction.getCurrency(), reportedCurrency);
        }
    }
}
