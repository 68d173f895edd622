package com.opentrips.trip.domain.strategy;

import com.opentrips.trip.domain.model.Trip;

/**
 * Concurrency-control mechanism for the seat counter of a trip.
 *
 * Implementations (bean names):
 * - pessimistic: SELECT FOR UPDATE on the trip row
 * - optimistic: @Version check, conflict surfaces as OptimisticLockingFailureException
 * - atomic: single guarded UPDATE statement
 *
 * All implementations must run inside the caller's transaction, so that the seat change,
 * the registration number and the registration row commit or roll back together.
 */
public interface CapacityStrategy {

    /**
     * Takes one seat.
     *
     * @param tripId Trip to reserve on
     * @return the trip as it stands after the reservation
     * @throws com.opentrips.trip.exception.CapacityExhaustedException when no seat is left
     * @throws com.opentrips.common.exception.ResourceNotFoundException when the trip does not exist
     */
    Trip reserve(Long tripId);

    /**
     * Returns one seat, clamped at capacity.
     *
     * @param tripId Trip to release on
     * @return the trip as it stands after the release
     */
    Trip release(Long tripId);

    /**
     * @return Strategy type (PESSIMISTIC_LOCK, OPTIMISTIC_LOCK, ATOMIC_UPDATE)
     */
    String getStrategyType();
}
