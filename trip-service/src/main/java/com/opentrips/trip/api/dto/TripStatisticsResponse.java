package com.opentrips.trip.api.dto;

import java.math.BigDecimal;

public record TripStatisticsResponse(
        long totalTrips,
        long activeTrips,
        long upcomingTrips,
        long completedTrips,
        long totalRegistrations,
        long confirmedRegistrations,
        BigDecimal totalRevenue,
        BigDecimal collectedRevenue,
        BigDecimal pendingRevenue
) {
}
