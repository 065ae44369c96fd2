package com.campus.payments.service;

import com.campus.payments.dto.StudentPaymentStatusView;
import com.campus.payments.entity.Student;
import com.campus.payments.entity.TermContext;
import com.campus.payments.entity.TermPaymentStatus;
import com.campus.payments.entity.Transaction;
import com.campus.payments.entity.TransactionStatus;
import com.campus.payments.exception.ResourceNotFoundException;
import com.campus.payments.repository.StudentRepository;
import com.campus.payments.repository.TransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StudentPaymentProjectionServiceTest {

    @Mock
    private StudentRepository studentRepository;

    @Mock
    private TransactionRepository transactionRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private StudentPaymentProjectionService projectionService;

    @BeforeEach
    void setUp() {
        projectionService = new StudentPaymentProjectionService(studentRepository, transactionRepository,
                new TransactionTemplate(transactionManager));
    }

    @Nested
    @DisplayName("Apply Tests")
    class ApplyTests {

        @Test
        @DisplayName("Should mark the student PAID for the transaction's term")
        void shouldApplySuccessfulPayment() {
            // Given
            Student student = student();
            when(studentRepository.findById(42L)).thenReturn(Optional.of(student));
            when(studentRepository.saveAndFlush(student)).thenReturn(student);

            // When
            Student updated = projectionService.applySuccessfulPayment(success(10L, "Fall", "2025-2026"));

            // Then
            assertThat(updated.getCurrentTermPaymentStatus()).isEqualTo(TermPaymentStatus.PAID);
            assertThat(updated.getLastPaidSemester()).isEqualTo("Fall");
            assertThat(updated.getLastPaidAcademicYear()).isEqualTo("2025-2026");
            assertThat(updated.getPaymentHistory()).containsExactly(10L);
        }

        @Test
        @DisplayName("Should not duplicate a transaction already in the history")
        void shouldBeIdempotent() {
            // Given
            Student student = student();
            student.recordPayment(10L, new TermContext("2025-2026", "Fall"));
            when(studentRepository.findById(42L)).thenReturn(Optional.of(student));
            when(studentRepository.saveAndFlush(student)).thenReturn(student);

            // When
            Student updated = projectionService.applySuccessfulPayment(success(10L, "Fall", "2025-2026"));

            // Then
            assertThat(updated.getPaymentHistory()).containsExactly(10L);
            assertThat(updated.getCurrentTermPaymentStatus()).isEqualTo(TermPaymentStatus.PAID);
        }

        @Test
        @DisplayName("Should fail when the student does not exist")
        void shouldFailForMissingStudent() {
            when(studentRepository.findById(42L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> projectionService.applySuccessfulPayment(success(10L, "Fall", "2025-2026")))
                    .isInstanceOf(ResourceNotFoundException.class);
            verify(studentRepository, never()).saveAndFlush(any());
        }
    }

    @Nested
    @DisplayName("Rebuild Tests")
    class RebuildTests {

        @Test
        @DisplayName("Should recompute history and last paid term from successful transactions")
        void shouldRebuildFromSuccessfulTransactions() {
            // Given
            Student student = student();
            student.getPaymentHistory().add(99L);
            when(studentRepository.findById(42L)).thenReturn(Optional.of(student));
            when(transactionRepository.findByStudentIdAndStatusOrderByPaidAtAsc(42L, TransactionStatus.SUCCESS))
                    .thenReturn(List.of(success(10L, "Fall", "2024-2025"), success(11L, "Spring", "2024-2025")));
            when(studentRepository.saveAndFlush(student)).thenReturn(student);

            // When
            StudentPaymentStatusView view = projectionService.rebuild(42L);

            // Then
            assertThat(view.currentTermPaymentStatus()).isEqualTo(TermPaymentStatus.PAID);
            assertThat(view.lastPaidSemester()).isEqualTo("Spring");
            assertThat(view.lastPaidAcademicYear()).isEqualTo("2024-2025");
            assertThat(view.paymentHistory()).containsExactly(10L, 11L);
        }

        @Test
        @DisplayName("Should reset a student without successful transactions to UNPAID")
        void shouldResetWithoutPayments() {
            // Given
            Student student = student();
            student.recordPayment(99L, new TermContext("2024-2025", "Fall"));
            when(studentRepository.findById(42L)).thenReturn(Optional.of(student));
            when(transactionRepository.findByStudentIdAndStatusOrderByPaidAtAsc(42L, TransactionStatus.SUCCESS))
                    .thenReturn(Collections.emptyList());
            when(studentRepository.saveAndFlush(student)).thenReturn(student);

            // When
            StudentPaymentStatusView view = projectionService.rebuild(42L);

            // Then
            assertThat(view.currentTermPaymentStatus()).isEqualTo(TermPaymentStatus.UNPAID);
            assertThat(view.lastPaidSemester()).isNull();
            assertThat(view.paymentHistory()).isEmpty();
        }
    }

    @Test
    @DisplayName("Should expose the current payment fields of a student")
    void shouldReturnPaymentStatus() {
        // Given
        Student student = student();
        student.recordPayment(12L, new TermContext("2025-2026", "Fall"));
        student.recordPayment(10L, new TermContext("2024-2025", "Spring"));
        when(studentRepository.findById(42L)).thenReturn(Optional.of(student));

        // When
        StudentPaymentStatusView view = projectionService.getPaymentStatus(42L);

        // Then
        assertThat(view.registrationNumber()).isEqualTo("CSC/2021/042");
        assertThat(view.paymentHistory()).containsExactly(10L, 12L);
    }

    private static Student student() {
        return Student.builder()
                .id(42L)
                .registrationNumber("CSC/2021/042")
                .name("Ada Obi")
                .email("ada@campus.test")
                .department("Computer Science")
                .build();
    }

    private static Transaction success(Long id, String semester, String academicYear) {
        return Transaction.builder()
                .id(id)
                .studentId(42L)
                .providerReference("ref-" + id)
                .providerName("paystack")
                .amount(500000L)
                .currency("NGN")
                .status(TransactionStatus.SUCCESS)
                .termContext(new TermContext(academicYear, semester))
                .build();
    }
}
