package com.campus.payments.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The billing period a payment is for, e.g. {@code Fall} of {@code 2025-2026}.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TermContext {

    @Column(name = "academic_year", nullable = false, length = 20)
    private String academicYear;

    @Column(name = "semester", nullable = false, length = 30)
    private String semester;

    @Override
    public String toString() {
        return semester + " " + academicYear;
    }
}
