package com.campus.payments.provider;

import com.campus.payments.entity.TermContext;

/**
 * Everything a gateway needs to create a charge. The amount is in the smallest currency unit.
 */
public record ChargeRequest(
        long amount,
        String currency,
        Long studentId,
        TermContext termContext,
        String payerEmail,
        String description
) {

    public PaymentMetadata toMetadata() {
        return new PaymentMetadata(studentId, termContext.getAcademicYear(), termContext.getSemester(), description);
    }
}
