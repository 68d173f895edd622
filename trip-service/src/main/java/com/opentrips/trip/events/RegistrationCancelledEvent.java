package com.opentrips.trip.events;

import com.opentrips.trip.domain.model.Registration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Raised when a registration is cancelled. {@code seatReleased} tells consumers
 * whether the trip got a seat back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationCancelledEvent {
    private Long registrationId;
    private Long organizationId;
    private Long tripId;
    private Long memberId;
    private String registrationNumber;
    private String reason;
    private BigDecimal refundAmount;
    private boolean seatReleased;
    private Instant timestamp;

    public static RegistrationCancelledEvent of(Registration registration, boolean seatReleased, Instant timestamp) {
        return RegistrationCancelledEvent.builder()
                .registrationId(registration.getId())
                .organizationId(registration.getOrganizationId())
                .tripId(registration.getTripId())
                .memberId(registration.getMemberId())
                .registrationNumber(registration.getRegistrationNumber())
                .reason(registration.getCancellationReason())
                .refundAmount(registration.getRefundAmount())
                .seatReleased(seatReleased)
                .timestamp(timestamp)
                .build();
    }
}
