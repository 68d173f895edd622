package com.opentrips.trip.exception;

import com.opentrips.common.exception.ConflictException;
import lombok.Getter;

/**
 * No seats left on the trip at registration time. Nothing was persisted.
 */
@Getter
public class CapacityExhaustedException extends ConflictException {
    private final Long tripId;

    public CapacityExhaustedException(Long tripId) {
        super(String.format("Trip %d is full: no available spots left", tripId), "CAPACITY_EXHAUSTED");
        this.tripId = tripId;
    }
}
