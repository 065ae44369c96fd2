package com.campus.payments.service;

import com.campus.payments.dto.InitiatePaymentRequest;
import com.campus.payments.dto.InitiatePaymentResponse;
import com.campus.payments.entity.TermContext;
import com.campus.payments.entity.Transaction;
import com.campus.payments.entity.TransactionStatus;
import com.campus.payments.exception.ResourceNotFoundException;
import com.campus.payments.provider.ChargeRequest;
import com.campus.payments.provider.PaymentProvider;
import com.campus.payments.provider.PaymentProviderRegistry;
import com.campus.payments.provider.ProviderCharge;
import com.campus.payments.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Creates a charge at the active provider and records it as a PENDING transaction.
 * The provider call happens before anything is written, so a gateway failure leaves no trace.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentInitiationService {

    private final StudentRepository studentRepository;
    private final PaymentProviderRegistry providerRegistry;
    private final TransactionStore transactionStore;

    public InitiatePaymentResponse initiate(InitiatePaymentRequest request) {
        if (!studentRepository.existsById(request.studentId())) {
            throw new ResourceNotFoundException("Student", request.studentId());
        }

        TermContext termContext = new TermContext(
                request.termContext().academicYear().trim(),
                request.termContext().semester().trim());
        String description = request.description() != null && !request.description().isBlank()
                ? request.description()
                : defaultDescription(termContext);
        String currency = request.currency().toUpperCase(Locale.ROOT);

        PaymentProvider provider = providerRegistry.active();
        ProviderCharge charge = provider.initiate(new ChargeRequest(
                request.amount(), currency, request.studentId(), termContext, request.payerEmail(), description));

        Transaction transaction = transactionStore.create(Transaction.builder()
                .studentId(request.studentId())
                .providerReference(charge.providerReference())
                .providerName(provider.providerId())
                .amount(request.amount())
                .currency(currency)
                .status(TransactionStatus.PENDING)
                .termContext(termContext)
                .description(description)
                .build());

        log.info("Payment {} initiated via {} for student {}: {} {} ({})",
                charge.providerReference(), provider.providerId(), request.studentId(),
                request.amount(), currency, termContext);

        return new InitiatePaymentResponse(
                charge.providerReference(),
                charge.authorizationUrl(),
                charge.accessCode(),
                transaction.getId());
    }

    static String defaultDescription(TermContext termContext) {
        return String.format("Fee payment for %s %s", termContext.getSemester(), termContext.getAcademicYear());
    }
}
