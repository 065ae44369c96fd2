package com.campus.payments.dto;

import com.campus.payments.entity.Student;
import com.campus.payments.entity.TermPaymentStatus;

import java.util.List;

public record StudentPaymentStatusView(
        Long studentId,
        String registrationNumber,
        TermPaymentStatus currentTermPaymentStatus,
        String lastPaidSemester,
        String lastPaidAcademicYear,
        List<Long> paymentHistory
) {

    public static StudentPaymentStatusView from(Student student) {
        return new StudentPaymentStatusView(
                student.getId(),
                student.getRegistrationNumber(),
                student.getCurrentTermPaymentStatus(),
                student.getLastPaidSemester(),
                student.getLastPaidAcademicYear(),
                student.getPaymentHistory().stream().sorted().toList()
        );
    }
}
