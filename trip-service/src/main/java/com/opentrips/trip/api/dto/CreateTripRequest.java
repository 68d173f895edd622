package com.opentrips.trip.api.dto;

import com.opentrips.trip.domain.model.Trip;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

public record CreateTripRequest(
        @NotBlank(message = "Name cannot be blank")
        String name,

        String description,

        @Size(max = 20, message = "Code must be at most 20 characters")
        String code,

        Trip.TripType tripType,

        @NotNull(message = "Start date cannot be null")
        LocalDate startDate,

        @NotNull(message = "End date cannot be null")
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

        @NotNull(message = "Capacity cannot be null")
        @PositiveOrZero(message = "Capacity cannot be negative")
        Integer capacity,

        @PositiveOrZero(message = "Waitlist capacity cannot be negative")
        Integer waitlistCapacity,

        Trip.TripStatus status,

        Long groupLeaderId,

        String notes
) {
}
