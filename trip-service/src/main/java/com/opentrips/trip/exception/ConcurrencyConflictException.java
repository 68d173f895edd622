package com.opentrips.trip.exception;

import com.opentrips.common.exception.ConflictException;

/**
 * The operation kept losing races with concurrent writers after all retries.
 * Safe for the caller to retry.
 */
public class ConcurrencyConflictException extends ConflictException {
    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause, "CONCURRENCY_CONFLICT");
    }
}
