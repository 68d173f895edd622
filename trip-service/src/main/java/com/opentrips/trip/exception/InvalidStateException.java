package com.opentrips.trip.exception;

import com.opentrips.common.exception.ConflictException;

/**
 * Operation is not allowed for the current state of the resource,
 * e.g. cancelling a registration twice.
 */
public class InvalidStateException extends ConflictException {
    public InvalidStateException(String message) {
        super(message, "INVALID_STATE");
    }
}
