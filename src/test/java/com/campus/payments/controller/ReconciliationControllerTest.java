package com.campus.payments.controller;

import com.campus.payments.config.PaymentProperties;
import com.campus.payments.dto.ReconciliationResult;
import com.campus.payments.entity.TransactionStatus;
import com.campus.payments.exception.GlobalExceptionHandler;
import com.campus.payments.exception.SweepAlreadyRunningException;
import com.campus.payments.repository.TransactionRepository;
import com.campus.payments.service.PendingPaymentSweeper;
import com.campus.payments.service.TransactionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ReconciliationControllerTest {

    @Mock
    private PendingPaymentSweeper sweeper;

    @Mock
    private TransactionStore transactionStore;

    @Mock
    private TransactionRepository transactionRepository;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        PaymentProperties properties = new PaymentProperties();
        properties.getSweep().setMaxAttempts(5);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ReconciliationController(sweeper, transactionStore, transactionRepository, properties))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should run a sweep and return its counts")
    void shouldRunSweep() throws Exception {
        ReconciliationResult result = ReconciliationResult.builder()
                .startedAt(OffsetDateTime.now())
                .build();
        result.incrementTotalProcessed();
        result.incrementUpdatedToSuccess();
        when(sweeper.sweepPendingTransactions()).thenReturn(result);

        mockMvc.perform(post("/api/v1/reconciliation/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalProcessed").value(1))
                .andExpect(jsonPath("$.updatedToSuccess").value(1));
    }

    @Test
    @DisplayName("Should answer 409 while a sweep is running")
    void shouldRefuseOverlappingSweep() throws Exception {
        when(sweeper.sweepPendingTransactions()).thenThrow(new SweepAlreadyRunningException());

        mockMvc.perform(post("/api/v1/reconciliation/run"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Should default the review threshold to the sweep attempt limit")
    void shouldUseSweepLimitForReview() throws Exception {
        when(transactionRepository.findTransactionsNeedingManualReview(TransactionStatus.PENDING, 5))
                .thenReturn(Collections.emptyList());

        mockMvc.perform(get("/api/v1/reconciliation/transactions/needs-review"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    @DisplayName("Should answer 404 for an unknown reference")
    void shouldReturnNotFoundForUnknownReference() throws Exception {
        when(transactionStore.findByReference("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/reconciliation/transactions/nope"))
                .andExpect(status().isNotFound());
    }
}
