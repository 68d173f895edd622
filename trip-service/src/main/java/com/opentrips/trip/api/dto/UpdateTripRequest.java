package com.opentrips.trip.api.dto;

import com.opentrips.trip.domain.model.Trip;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update: null fields are left untouched.
 */
public record UpdateTripRequest(
        String name,
        String description,

        @Size(max = 20, message = "Code must be at most 20 characters")
        String code,

        Trip.TripType tripType,
        LocalDate startDate,
        LocalDate endDate,
        LocalDate registrationDeadline,
        String destination,

        @PositiveOrZero(message = "Price cannot be negative")
        @Digits(integer = 10, fraction = 2,
                message = "Price must have at most 10 integer digits and 2 decimals")
        BigDecimal price,

        @PositiveOrZero(message = "Deposit cannot be negative")
        @Digits(integer = 10, fraction = 2,
                message = "Deposit must have at most 10 integer digits and 2 decimals")
        BigDecimal depositAmount,

        @Pattern(regexp = "[A-Z]{3}", message = "Currency must be a 3-letter ISO code")
        String currency,

        @PositiveOrZero(message = "Capacity cannot be negative")
        Integer capacity,

        @PositiveOrZero(message = "Waitlist capacity cannot be negative")
        Integer waitlistCapacity,

        Long groupLeaderId,
        String notes
) {
}
