package com.opentrips.trip.api.dto;

import com.opentrips.trip.domain.model.RegistrationPayment;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record PaymentResponse(
        Long id,
        Long registrationId,
        BigDecimal amount,
        String paymentMethod,
        String referenceNumber,
        String notes,
        LocalDateTime recordedAt
) {
    public static PaymentResponse from(RegistrationPayment payment) {
        return new PaymentResponse(
                payment.getId(),
                payment.getRegistrationId(),
                payment.getAmount(),
                payment.getPaymentMethod(),
                payment.getReferenceNumber(),
                payment.getNotes(),
                payment.getRecordedAt()
        );
    }
}
