package com.opentrips.common.util;

import com.opentrips.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MoneyAmountsTest {

    @Test
    @DisplayName("amounts that fit DECIMAL(12, 2) are accepted, trailing zeros included")
    void requireStorable_accepts() {
        assertThatCode(() -> MoneyAmounts.requireStorable("amount", new BigDecimal("9999999999.99")))
                .doesNotThrowAnyException();
        assertThatCode(() -> MoneyAmounts.requireStorable("amount", new BigDecimal("12.500")))
                .doesNotThrowAnyException();
        assertThatCode(() -> MoneyAmounts.requireStorable("amount", new BigDecimal("1E+3")))
                .doesNotThrowAnyException();
        assertThatCode(() -> MoneyAmounts.requireStorable("amount", null))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("a third decimal place is a validation error, not a rounding")
    void requireStorable_tooManyDecimals() {
        assertThatThrownBy(() -> MoneyAmounts.requireStorable("amount", new BigDecimal("0.001")))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "VALIDATION_ERROR")
                .hasMessageContaining("decimal places");
    }

    @Test
    @DisplayName("more than ten integer digits is a validation error")
    void requireStorable_tooLarge() {
        assertThatThrownBy(() -> MoneyAmounts.requireStorable("price", new BigDecimal("10000000000")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("integer digits");
    }
}
