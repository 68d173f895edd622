package com.opentrips.trip.api.dto;

import com.opentrips.trip.domain.model.Trip;
import jakarta.validation.constraints.NotNull;

public record UpdateTripStatusRequest(
        @NotNull(message = "Status cannot be null")
        Trip.TripStatus status
) {
}
