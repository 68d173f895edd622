package com.opentrips.trip.domain.service;

import com.opentrips.trip.domain.model.Registration.PaymentStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Derives payment figures of a registration from its amounts.
 * Stateless; every input is explicit, including the previous payment status.
 */
@Component
public class BalanceCalculator {

    /**
     * Remaining amount owed, floored at zero (overpayment is clamped, not rejected).
     */
    public BigDecimal balanceDue(BigDecimal totalAmount, BigDecimal amountPaid) {
        BigDecimal balance = orZero(totalAmount).subtract(orZero(amountPaid));
        return balance.signum() > 0 ? balance : BigDecimal.ZERO;
    }

    /**
     * Payment status after a payment has been applied.
     * <p>
     * {@code DEPOSIT_PAID} only fires on the transition out of {@code PENDING};
     * later partial payments report {@code PARTIAL}.
     */
    public PaymentStatus paymentStatus(BigDecimal totalAmount, BigDecimal amountPaid,
                                       BigDecimal depositAmount, PaymentStatus priorStatus) {
        if (balanceDue(totalAmount, amountPaid).signum() == 0) {
            return PaymentStatus.PAID;
        }
        if (priorStatus == PaymentStatus.PENDING
                && orZero(amountPaid).compareTo(orZero(depositAmount)) >= 0) {
            return PaymentStatus.DEPOSIT_PAID;
        }
        return PaymentStatus.PARTIAL;
    }

    /**
     * Part of the paid amount that counts towards the trip deposit.
     */
    public BigDecimal depositPaid(BigDecimal amountPaid, BigDecimal depositAmount) {
        return orZero(amountPaid).min(orZero(depositAmount));
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
