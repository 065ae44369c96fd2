package com.campus.payments.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Student record as far as payments are concerned. Profile fields are owned by the
 * registration module; the payment projection fields below are written only by
 * {@link com.campus.payments.service.StudentPaymentProjectionService}.
 */
@Entity
@Table(name = "students")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Student {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "registration_number", unique = true, nullable = false, length = 40)
    private String registrationNumber;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String email;

    private String department;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_term_payment_status", nullable = false, length = 20)
    @Builder.Default
    private TermPaymentStatus currentTermPaymentStatus = TermPaymentStatus.UNPAID;

    @Column(name = "last_paid_semester", length = 30)
    private String lastPaidSemester;

    @Column(name = "last_paid_academic_year", length = 20)
    private String lastPaidAcademicYear;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "student_payment_history",
            joinColumns = @JoinColumn(name = "student_id"),
            uniqueConstraints = @UniqueConstraint(columnNames = {"student_id", "transaction_id"}))
    @Column(name = "transaction_id", nullable = false)
    @Builder.Default
    private Set<Long> paymentHistory = new LinkedHashSet<>();

    @Version
    private Long version;

    /**
     * Marks the term of a confirmed transaction as paid. Adding an id that is already in the
     * history leaves the history unchanged.
     *
     * @return true if the transaction id was not yet part of the history
     */
    public boolean recordPayment(Long transactionId, TermContext termContext) {
        this.currentTermPaymentStatus = TermPaymentStatus.PAID;
        if (termContext != null) {
            this.lastPaidSemester = termContext.getSemester();
            this.lastPaidAcademicYear = termContext.getAcademicYear();
        }
        return paymentHistory.add(transactionId);
    }
}
