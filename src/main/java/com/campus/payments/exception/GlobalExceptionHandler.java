package com.campus.payments.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Renders payment errors as RFC 7807 problem details. Bean validation and malformed request
 * bodies are handled by the base class.
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex) {
        log.warn("Rejected invalid input: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(ResourceNotFoundException ex) {
        ResponseEntity<ProblemDetail> response = problem(HttpStatus.NOT_FOUND,
                ex.getResourceType() + " not found", ex.getMessage());
        response.getBody().setProperty("resourceId", String.valueOf(ex.getResourceId()));
        return response;
    }

    @ExceptionHandler(ReferenceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleReferenceNotFound(ReferenceNotFoundException ex) {
        log.warn("{} has no record of reference {}", ex.getProviderName(), ex.getProviderReference());
        ResponseEntity<ProblemDetail> response = problem(HttpStatus.NOT_FOUND,
                "Payment reference not found", ex.getMessage());
        response.getBody().setProperty("provider", ex.getProviderName());
        return response;
    }

    @ExceptionHandler(DuplicateReferenceException.class)
    public ResponseEntity<ProblemDetail> handleDuplicate(DuplicateReferenceException ex) {
        log.warn("Duplicate payment reference {}", ex.getProviderReference());
        return problem(HttpStatus.CONFLICT, "Duplicate payment reference", ex.getMessage());
    }

    @ExceptionHandler(SweepAlreadyRunningException.class)
    public ResponseEntity<ProblemDetail> handleSweepRunning(SweepAlreadyRunningException ex) {
        return problem(HttpStatus.CONFLICT, "Sweep in progress", ex.getMessage());
    }

    @ExceptionHandler(SignatureInvalidException.class)
    public ResponseEntity<ProblemDetail> handleSignature(SignatureInvalidException ex) {
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "Invalid webhook signature");
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ProblemDetail> handleGateway(GatewayException ex) {
        log.warn("Payment gateway {} error (retryable={}): {}",
                ex.getProviderName(), ex.isRetryable(), ex.getMessage());
        String title = ex instanceof GatewayRejectedException
                ? "Payment gateway rejected the request"
                : "Payment gateway unavailable";
        ResponseEntity<ProblemDetail> response = problem(HttpStatus.BAD_GATEWAY, title, ex.getMessage());
        response.getBody().setProperty("provider", ex.getProviderName());
        response.getBody().setProperty("retryable", ex.isRetryable());
        return response;
    }

    @ExceptionHandler(ReconciliationConflictException.class)
    public ResponseEntity<ProblemDetail> handleConflict(ReconciliationConflictException ex) {
        log.error("Reconciliation invariant violated for {}: {}", ex.getProviderReference(), ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Reconciliation conflict",
                "The payment could not be reconciled; it has been logged for investigation");
    }

    private static ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return ResponseEntity.status(status).body(problem);
    }
}
