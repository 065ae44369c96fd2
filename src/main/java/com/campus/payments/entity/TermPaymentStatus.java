package com.campus.payments.entity;

/**
 * Payment standing of a student for the current term, as shown on the student record.
 */
public enum TermPaymentStatus {
    PAID,
    UNPAID,
    PENDING
}
