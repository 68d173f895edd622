package com.opentrips.trip.events;

import com.opentrips.trip.domain.model.Registration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Raised when the first payment moves a registration from PENDING to CONFIRMED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationConfirmedEvent {
    private Long registrationId;
    private Long organizationId;
    private Long tripId;
    private Long memberId;
    private String registrationNumber;
    private BigDecimal amountPaid;
    private BigDecimal balanceDue;
    private String paymentStatus;
    private Instant timestamp;

    public static RegistrationConfirmedEvent of(Registration registration, Instant timestamp) {
        return RegistrationConfirmedEvent.builder()
                .registrationId(registration.getId())
                .organizationId(registration.getOrganizationId())
                .tripId(registration.getTripId())
                .memberId(registration.getMemberId())
                .registrationNumber(registration.getRegistrationNumber())
                .amountPaid(registration.getAmountPaid())
                .balanceDue(registration.getBalanceDue())
                .paymentStatus(registration.getPaymentStatus().name())
                .timestamp(timestamp)
                .build();
    }
}
