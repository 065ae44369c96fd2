package com.campus.payments.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/initiate-payment}. The amount is already in the smallest currency
 * unit (kobo, cents).
 */
public record InitiatePaymentRequest(
        @NotNull @Positive Long amount,
        @NotBlank @Pattern(regexp = "[A-Za-z]{3}", message = "must be a three-letter currency code") String currency,
        @NotNull Long studentId,
        @NotNull @Valid TermContextRequest termContext,
        @NotBlank @Email String payerEmail,
        @Size(max = 255) String description
) {

    public record TermContextRequest(
            @NotBlank @Size(max = 20) String academicYear,
            @NotBlank @Size(max = 30) String semester
    ) {
    }
}
