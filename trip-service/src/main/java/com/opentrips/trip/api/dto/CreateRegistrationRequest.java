package com.opentrips.trip.api.dto;

import com.opentrips.trip.domain.model.Registration;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * {@code totalAmount} overrides the trip price for this registration only.
 */
public record CreateRegistrationRequest(
        @NotNull(message = "Trip ID cannot be null")
        Long tripId,

        @NotNull(message = "Member ID cannot be null")
        Long memberId,

        Registration.RoomType roomType,

        @PositiveOrZero(message = "Total amount cannot be negative")
        @Digits(integer = 10, fraction = 2,
                message = "Total amount must have at most 10 integer digits and 2 decimals")
        BigDecimal totalAmount,

        String passportNumber,
        LocalDate passportExpiry,
        String passportCountry,
        String specialRequests,
        String notes
) {
}
