package com.opentrips.trip.api.dto;

import com.opentrips.trip.domain.model.Registration;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record UpdateVisaStatusRequest(
        @NotNull(message = "Visa status cannot be null")
        Registration.VisaStatus visaStatus,

        String visaNumber,
        LocalDate visaIssueDate,
        LocalDate visaExpiryDate,
        String visaNotes
) {
}
