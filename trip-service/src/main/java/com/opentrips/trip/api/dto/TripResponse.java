package com.opentrips.trip.api.dto;

import com.opentrips.trip.domain.model.Trip;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record TripResponse(
        Long id,
        Long organizationId,
        String name,
        String description,
        String code,
        Trip.TripType tripType,
        LocalDate startDate,
        LocalDate endDate,
        LocalDate registrationDeadline,
        String destination,
        BigDecimal price,
        BigDecimal depositAmount,
        String currency,
        Integer capacity,
        Integer availableSpots,
        Integer waitlistCapacity,
        Trip.TripStatus status,
        Long groupLeaderId,
        String notes,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static TripResponse from(Trip trip) {
        return new TripResponse(
                trip.getId(),
                trip.getOrganizationId(),
                trip.getName(),
                trip.getDescription(),
                trip.getCode(),
                trip.getTripType(),
                trip.getStartDate(),
                trip.getEndDate(),
                trip.getRegistrationDeadline(),
                trip.getDestination(),
                trip.getPrice(),
                trip.getDepositAmount(),
                trip.getCurrency(),
                trip.getCapacity(),
                trip.getAvailableSpots(),
                trip.getWaitlistCapacity(),
                trip.getStatus(),
                trip.getGroupLeaderId(),
                trip.getNotes(),
                trip.getCreatedAt(),
                trip.getUpdatedAt()
        );
    }
}
