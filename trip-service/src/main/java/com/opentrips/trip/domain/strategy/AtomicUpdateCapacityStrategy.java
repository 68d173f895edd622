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
 * Capacity strategy using a single guarded UPDATE.
 *
 *   UPDATE trips
 *   SET available_spots = available_spots - 1
 *   WHERE id = :id AND available_spots > 0;
 *
 * The counter is never derived from in-memory entity state. Zero affected rows
 * means the trip is full (or does not exist). The row stays write-locked by the
 * UPDATE until the caller commits.
 */
@Slf4j
@Component("atomic")
@RequiredArgsConstructor
public class AtomicUpdateCapacityStrategy implements CapacityStrategy {

    private final TripRepository repository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Trip reserve(Long tripId) {
        int updatedRows = repository.reserveSpotAtomically(tripId);
        if (updatedRows == 0) {
            if (!repository.existsById(tripId)) {
                throw new ResourceNotFoundException("Trip", tripId);
            }
            throw new CapacityExhaustedException(tripId);
        }
        log.debug("Reserved spot on trip {} with guarded update", tripId);
        return reload(tripId);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Trip release(Long tripId) {
        int updatedRows = repository.releaseSpotAtomically(tripId);
        if (updatedRows == 0) {
            // either missing or already at capacity
            Trip trip = reload(tripId);
            log.warn("Release on trip {} ignored: already at capacity {}", tripId, trip.getCapacity());
            return trip;
        }
        log.debug("Released spot on trip {} with guarded update", tripId);
        return reload(tripId);
    }

    @Override
    public String getStrategyType() {
        return "ATOMIC_UPDATE";
    }

    private Trip reload(Long tripId) {
        return repository.findById(tripId)
                .orElseThrow(() -> new ResourceNotFoundException("Trip", tripId));
    }
}
