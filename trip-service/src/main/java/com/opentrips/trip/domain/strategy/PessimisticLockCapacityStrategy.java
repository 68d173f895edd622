package com.opentrips.trip.domain.strategy;

import com.opentrips.common.exception.ResourceNotFoundException;
import com.opentrips.trip.domain.model.Trip;
import com.opentrips.trip.domain.repository.TripRepository;
import com.opentrips.trip.exception.CapacityExhaustedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Capacity strategy using a row lock on the trip (SELECT FOR UPDATE).
 *
 * The lock is held until the registration transaction commits, so concurrent
 * registrations for the same trip are serialized, numbering included.
 *
 * Flow:
 * 1. Lock trip row
 * 2. Check available spots
 * 3. Adjust counter
 * 4. Caller commits (releases lock)
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockCapacityStrategy implements CapacityStrategy {

    private final TripRepository repository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Trip reserve(Long tripId) {
        Trip trip = lockTrip(tripId);
        if (!trip.hasAvailableSpot()) {
            throw new CapacityExhaustedException(tripId);
        }
        trip.reserveSpot();
        log.debug("Reserved spot on trip {} under row lock, {} left", tripId, trip.getAvailableSpots());
        return repository.save(trip);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Trip release(Long tripId) {
        Trip trip = lockTrip(tripId);
        trip.releaseSpot();
        log.debug("Released spot on trip {} under row lock, {} available", tripId, trip.getAvailableSpots());
        return repository.save(trip);
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }

    private Trip lockTrip(Long tripId) {
        return repository.findByIdWithLock(tripId)
                .orElseThrow(() -> new ResourceNotFoundException("Trip", tripId));
    }
}
