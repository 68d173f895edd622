package com.opentrips.trip.api.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record RecordPaymentRequest(
        @NotNull(message = "Amount cannot be null")
        @Positive(message = "Amount must be positive")
        @Digits(integer = 10, fraction = 2,
                message = "Amount must have at most 10 integer digits and 2 decimals")
        BigDecimal amount,

        @NotBlank(message = "Payment method cannot be blank")
        String paymentMethod,

        String referenceNumber,
        String notes
) {
}
