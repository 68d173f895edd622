package com.opentrips.trip.api.dto;

import com.opentrips.trip.domain.model.Registration;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Per-trip rollup. Every enum constant appears as a key, with zero when unused.
 * Revenue figures ignore cancelled registrations; {@code collectionRate} is a percentage.
 */
public record TripReportResponse(
        Long tripId,
        String tripName,
        int capacity,
        int availableSpots,
        int reservedSpots,
        Map<Registration.RegistrationStatus, Long> byStatus,
        Map<Registration.PaymentStatus, Long> byPaymentStatus,
        Map<Registration.VisaStatus, Long> byVisaStatus,
        Map<Registration.RoomType, Long> byRoomType,
        BigDecimal expectedRevenue,
        BigDecimal collectedRevenue,
        BigDecimal pendingRevenue,
        BigDecimal collectionRate
) {
}
