package com.campus.payments.controller;

import com.campus.payments.dto.InitiatePaymentRequest;
import com.campus.payments.dto.InitiatePaymentResponse;
import com.campus.payments.dto.VerificationOutcome;
import com.campus.payments.dto.WebhookOutcome;
import com.campus.payments.service.PaymentInitiationService;
import com.campus.payments.service.ReconciliationEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirements;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;
import java.util.Map;

/**
 * REST API for the payment lifecycle.
 * <p>
 * Provides endpoints for:
 * - Initiating a charge at the active provider
 * - Confirming a payment from the client after checkout
 * - Receiving provider webhooks (signature-authenticated, no bearer token)
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Payments", description = "Tuition payment initiation, confirmation and webhooks")
public class PaymentController {

    private static final Map<String, Object> WEBHOOK_ACK = Map.of("received", true);

    private final PaymentInitiationService initiationService;
    private final ReconciliationEngine reconciliationEngine;

    @Operation(
            summary = "Initiate a payment",
            description = "Creates a charge at the active payment provider and records it as pending. "
                    + "The amount is in the smallest currency unit."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Charge created",
                    content = @Content(schema = @Schema(implementation = InitiatePaymentResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "404", description = "Student not found"),
            @ApiResponse(responseCode = "409", description = "Provider reference already recorded"),
            @ApiResponse(responseCode = "502", description = "Payment gateway unavailable or declined the charge")
    })
    @PostMapping("/initiate-payment")
    public ResponseEntity<InitiatePaymentResponse> initiatePayment(@Valid @RequestBody InitiatePaymentRequest request) {
        return ResponseEntity.ok(initiationService.initiate(request));
    }

    @Operation(
            summary = "Verify a payment",
            description = "Asks the provider for the current status of a charge and records a terminal answer. "
                    + "Already settled payments are returned without contacting the provider."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Current status",
                    content = @Content(schema = @Schema(implementation = VerificationOutcome.class))),
            @ApiResponse(responseCode = "404", description = "Unknown reference"),
            @ApiResponse(responseCode = "502", description = "Payment gateway unavailable")
    })
    @GetMapping("/verify-payment/{reference}")
    public ResponseEntity<VerificationOutcome> verifyPayment(
            @Parameter(description = "Provider reference returned at initiation") @PathVariable String reference,
            @Parameter(hidden = true) Principal caller) {
        return ResponseEntity.ok(reconciliationEngine.confirmFromClient(reference,
                caller != null ? caller.getName() : null));
    }

    @Operation(summary = "Webhook for the active provider")
    @SecurityRequirements
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Event accepted"),
            @ApiResponse(responseCode = "400", description = "Malformed event"),
            @ApiResponse(responseCode = "401", description = "Invalid signature")
    })
    @PostMapping("/webhook")
    public ResponseEntity<Map<String, Object>> webhook(@RequestBody byte[] rawBody,
                                                       @RequestHeader HttpHeaders headers) {
        return acknowledge(reconciliationEngine.handleWebhook(null, rawBody, headers));
    }

    @Operation(summary = "Webhook for a named provider")
    @SecurityRequirements
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Event accepted"),
            @ApiResponse(responseCode = "400", description = "Malformed event"),
            @ApiResponse(responseCode = "401", description = "Invalid signature"),
            @ApiResponse(responseCode = "404", description = "Unknown provider")
    })
    @PostMapping("/webhook/{provider}")
    public ResponseEntity<Map<String, Object>> providerWebhook(
            @Parameter(description = "Provider id, e.g. paystack or stripe") @PathVariable String provider,
            @RequestBody byte[] rawBody,
            @RequestHeader HttpHeaders headers) {
        return acknowledge(reconciliationEngine.handleWebhook(provider, rawBody, headers));
    }

    private ResponseEntity<Map<String, Object>> acknowledge(WebhookOutcome outcome) {
        log.debug("Webhook {} for {}: {}", outcome.eventType(), outcome.reference(), outcome.result());
        return ResponseEntity.ok(WEBHOOK_ACK);
    }
}
