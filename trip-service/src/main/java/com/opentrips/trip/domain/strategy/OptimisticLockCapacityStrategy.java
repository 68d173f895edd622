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
 * Capacity strategy using version-based conflict detection (@Version on Trip).
 *
 * The change is flushed immediately so a stale version fails here, inside the
 * registration transaction, with OptimisticLockingFailureException. The transaction
 * is then rolled back and the whole registration unit is retried by the caller;
 * retrying only this method would run against an already rolled-back transaction.
 *
 * Flow:
 * 1. Read trip with version
 * 2. Check available spots
 * 3. Adjust counter and flush (version checked)
 */
@Slf4j
@Component("optimistic")
@RequiredArgsConstructor
public class OptimisticLockCapacityStrategy implements CapacityStrategy {

    private final TripRepository repository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Trip reserve(Long tripId) {
        Trip trip = findTrip(tripId);
        if (!trip.hasAvailableSpot()) {
            throw new CapacityExhaustedException(tripId);
        }
        trip.reserveSpot();
        // throws OptimisticLockingFailureException if another writer got there first
        Trip saved = repository.saveAndFlush(trip);
        log.debug("Reserved spot on trip {} at version {}", tripId, saved.getVersion());
        return saved;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Trip release(Long tripId) {
        Trip trip = findTrip(tripId);
        trip.releaseSpot();
        Trip saved = repository.saveAndFlush(trip);
        log.debug("Released spot on trip {} at version {}", tripId, saved.getVersion());
        return saved;
    }

    @Override
    public String getStrategyType() {
        return "OPTIMISTIC_LOCK";
    }

    private Trip findTrip(Long tripId) {
        return repository.findById(tripId)
                .orElseThrow(() -> new ResourceNotFoundException("Trip", tripId));
    }
}
