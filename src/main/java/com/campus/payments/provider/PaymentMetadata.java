package com.campus.payments.provider;

import com.campus.payments.entity.TermContext;

/**
 * Metadata attached to a charge at initiation and echoed back by the provider in verify
 * responses and webhook events. It is what allows a transaction to be reconstructed when the
 * local record is missing.
 */
public record PaymentMetadata(Long studentId, String academicYear, String semester, String description) {

    public static final String STUDENT_ID = "student_id";
    public static final String ACADEMIC_YEAR = "academic_year";
    public static final String SEMESTER = "semester";
    public static final String DESCRIPTION = "description";

    private static final PaymentMetadata EMPTY = new PaymentMetadata(null, null, null, null);

    public static PaymentMetadata empty() {
        return EMPTY;
    }

    public boolean isComplete() {
        return studentId != null && hasText(academicYear) && hasText(semester);
    }

    public TermContext termContext() {
        return new TermContext(academicYear, semester);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
