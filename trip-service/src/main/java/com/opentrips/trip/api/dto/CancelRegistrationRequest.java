package com.opentrips.trip.api.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record CancelRegistrationRequest(
        String reason,

        @PositiveOrZero(message = "Refund amount cannot be negative")
        @Digits(integer = 10, fraction = 2,
                message = "Refund amount must have at most 10 integer digits and 2 decimals")
        BigDecimal refundAmount
) {
}
