package com.campus.payments.service;

import com.campus.payments.dto.StudentPaymentStatusView;
import com.campus.payments.entity.Student;
import com.campus.payments.entity.TermPaymentStatus;
import com.campus.payments.entity.Transaction;
import com.campus.payments.entity.TransactionStatus;
import com.campus.payments.exception.ResourceNotFoundException;
import com.campus.payments.repository.StudentRepository;
import com.campus.payments.repository.TransactionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maintains the payment fields on the student record.
 * <p>
 * Each update runs in its own database transaction, committed inside the retried method, so
 * an optimistic-lock conflict on the student row is retried from a fresh read. The update is
 * idempotent (history is a set), which is what makes the retry safe.
 */
@Service
@Slf4j
public class StudentPaymentProjectionService {

    private final StudentRepository studentRepository;
    private final TransactionRepository transactionRepository;
    private final TransactionTemplate transactionTemplate;

    public StudentPaymentProjectionService(StudentRepository studentRepository,
                                           TransactionRepository transactionRepository,
                                           TransactionTemplate transactionTemplate) {
        this.studentRepository = studentRepository;
        this.transactionRepository = transactionRepository;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Marks the transaction's term as paid and adds it to the student's history.
     */
    @Retryable(
            retryFor = ObjectOptimisticLockingFailureException.class,
            maxAttempts = 5,
            backoff = @Backoff(delay = 50, multiplier = 2)
    )
    public Student applySuccessfulPayment(Transaction transaction) {
        return transactionTemplate.execute(status -> {
            Student student = loadStudent(transaction.getStudentId());
            boolean added = student.recordPayment(transaction.getId(), transaction.getTermContext());
            Student saved = studentRepository.saveAndFlush(student);
            if (added) {
                log.info("Student {} marked PAID for {} by transaction {}",
                        student.getId(), transaction.getTermContext(), transaction.getProviderReference());
            } else {
                log.debug("Transaction {} already in history of student {}",
                        transaction.getProviderReference(), student.getId());
            }
            return saved;
        });
    }

    public StudentPaymentStatusView getPaymentStatus(Long studentId) {
        return StudentPaymentStatusView.from(loadStudent(studentId));
    }

    /**
     * Recomputes the projection from the stored SUCCESS transactions. Used to repair a student
     * record after a projection update failed behind a successful transition.
     */
    @Retryable(
            retryFor = ObjectOptimisticLockingFailureException.class,
            maxAttempts = 5,
            backoff = @Backoff(delay = 50, multiplier = 2)
    )
    public StudentPaymentStatusView rebuild(Long studentId) {
        Student rebuilt = transactionTemplate.execute(status -> {
            Student student = loadStudent(studentId);
            List<Transaction> successful = transactionRepository
                    .findByStudentIdAndStatusOrderByPaidAtAsc(studentId, TransactionStatus.SUCCESS);

            Set<Long> history = new LinkedHashSet<>();
            successful.forEach(tx -> history.add(tx.getId()));
            student.getPaymentHistory().retainAll(history);
            student.getPaymentHistory().addAll(history);

            if (successful.isEmpty()) {
                student.setCurrentTermPaymentStatus(TermPaymentStatus.UNPAID);
                student.setLastPaidSemester(null);
                student.setLastPaidAcademicYear(null);
            } else {
                Transaction latest = successful.get(successful.size() - 1);
                student.setCurrentTermPaymentStatus(TermPaymentStatus.PAID);
                student.setLastPaidSemester(latest.getTermContext().getSemester());
                student.setLastPaidAcademicYear(latest.getTermContext().getAcademicYear());
            }
            return studentRepository.saveAndFlush(student);
        });

        log.info("Rebuilt payment projection for student {}: {} with {} payments",
                studentId, rebuilt.getCurrentTermPaymentStatus(), rebuilt.getPaymentHistory().size());
        return StudentPaymentStatusView.from(rebuilt);
    }

    private Student loadStudent(Long studentId) {
        return studentRepository.findById(studentId)
                .orElseThrow(() -> new ResourceNotFoundException("Student", studentId));
    }
}
