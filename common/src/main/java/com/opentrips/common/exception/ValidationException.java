package com.opentrips.common.exception;

/**
 * Input that passed bean validation but breaks a domain rule
 * (non-positive payment, refund larger than what was paid, ...).
 */
public class ValidationException extends BusinessException {
    public ValidationException(String message) {
        super(message, "VALIDATION_ERROR");
    }
}
