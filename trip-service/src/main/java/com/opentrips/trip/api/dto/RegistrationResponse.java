package com.opentrips.trip.api.dto;

import com.opentrips.trip.domain.model.Member;
import com.opentrips.trip.domain.model.Registration;
import com.opentrips.trip.domain.model.Trip;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Registration joined with summaries of its trip and member.
 */
public record RegistrationResponse(
        Long id,
        Long organizationId,
        String registrationNumber,
        LocalDate registrationDate,
        Registration.RegistrationStatus status,
        Registration.PaymentStatus paymentStatus,
        BigDecimal totalAmount,
        BigDecimal amountPaid,
        BigDecimal depositPaid,
        BigDecimal balanceDue,
        String currency,
        Registration.RoomType roomType,
        String passportNumber,
        LocalDate passportExpiry,
        String passportCountry,
        Registration.VisaStatus visaStatus,
        String visaNumber,
        LocalDate visaIssueDate,
        LocalDate visaExpiryDate,
        String visaNotes,
        String specialRequests,
        String notes,
        LocalDateTime cancelledAt,
        String cancellationReason,
        BigDecimal refundAmount,
        LocalDate refundDate,
        TripSummary trip,
        MemberSummary member,
        LocalDateTime createdAt
) {
    public record TripSummary(
            Long id,
            String name,
            String code,
            LocalDate startDate,
            LocalDate endDate,
            Trip.TripStatus status,
            Integer availableSpots
    ) {
        static TripSummary from(Trip trip) {
            return new TripSummary(trip.getId(), trip.getName(), trip.getCode(),
                    trip.getStartDate(), trip.getEndDate(), trip.getStatus(), trip.getAvailableSpots());
        }
    }

    public record MemberSummary(
            Long id,
            String fullName,
            String email,
            String phone
    ) {
        static MemberSummary from(Member member) {
            return new MemberSummary(member.getId(), member.fullName(), member.getEmail(), member.getPhone());
        }
    }

    /**
     * Trip and member may be null when they are not at hand; the member falls back to its id.
     */
    public static RegistrationResponse from(Registration registration, Trip trip, Member member) {
        return new RegistrationResponse(
                registration.getId(),
                registration.getOrganizationId(),
                registration.getRegistrationNumber(),
                registration.getRegistrationDate(),
                registration.getStatus(),
                registration.getPaymentStatus(),
                registration.getTotalAmount(),
                registration.getAmountPaid(),
                registration.getDepositPaid(),
                registration.getBalanceDue(),
                registration.getCurrency(),
                registration.getRoomType(),
                registration.getPassportNumber(),
                registration.getPassportExpiry(),
                registration.getPassportCountry(),
                registration.getVisaStatus(),
                registration.getVisaNumber(),
                registration.getVisaIssueDate(),
                registration.getVisaExpiryDate(),
                registration.getVisaNotes(),
                registration.getSpecialRequests(),
                registration.getNotes(),
                registration.getCancelledAt(),
                registration.getCancellationReason(),
                registration.getRefundAmount(),
                registration.getRefundDate(),
                trip != null ? TripSummary.from(trip) : null,
                member != null
                        ? MemberSummary.from(member)
                        : new MemberSummary(registration.getMemberId(), null, null, null),
                registration.getCreatedAt()
        );
    }
}
