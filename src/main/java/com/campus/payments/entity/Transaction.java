package com.campus.payments.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * One payment attempt by a student for a billing term.
 * <p>
 * The provider_reference is the identifier issued by the payment provider when the charge was
 * created (Paystack reference, Stripe checkout session id). It is the idempotency key for every
 * reconciliation path. Status changes only go through
 * {@link com.campus.payments.service.TransactionStore#transitionToTerminal}.
 */
@Entity
@Table(name = "payment_transactions", indexes = {
        @Index(name = "idx_payment_status", columnList = "status"),
        @Index(name = "idx_payment_provider_reference", columnList = "provider_reference", unique = true),
        @Index(name = "idx_payment_student", columnList = "student_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "provider_reference", nullable = false, unique = true, length = 100)
    private String providerReference;

    @Column(name = "provider_name", nullable = false, length = 30)
    private String providerName;

    /**
     * Smallest currency unit (kobo, cents).
     */
    @Column(nullable = false)
    private Long amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionStatus status;

    @Embedded
    private TermContext termContext;

    @Column(length = 255)
    private String description;

    @Column(name = "paid_at")
    private OffsetDateTime paidAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "verification_attempts")
    @Builder.Default
    private Integer verificationAttempts = 0;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @PrePersist
    protected void onCreate() {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now(ZoneOffset.UTC);
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
