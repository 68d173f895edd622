package com.opentrips.trip.domain.repository;

import com.opentrips.trip.domain.model.Trip;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for {@link Trip}.
 * Offers the three access paths used by the capacity strategies: row lock,
 * versioned read, and guarded single-statement update.
 */
public interface TripRepository extends JpaRepository<Trip, Long> {

    /**
     * SELECT ... FOR UPDATE on the trip row. Holds until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Trip t WHERE t.id = :id")
    Optional<Trip> findByIdWithLock(@Param("id") Long id);

    /**
     * Takes one seat in a single statement.
     * Returns 1 on success, 0 when the trip is full (or absent).
     * The version is bumped so optimistic readers notice the change.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Trip t
           SET t.availableSpots = t.availableSpots - 1,
               t.version = t.version + 1
           WHERE t.id = :id
             AND t.availableSpots > 0
           """)
    int reserveSpotAtomically(@Param("id") Long id);

    /**
     * Gives one seat back in a single statement. Returns 0 when the trip is already
     * at capacity, which callers treat as a clamped no-op.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Trip t
           SET t.availableSpots = t.availableSpots + 1,
               t.version = t.version + 1
           WHERE t.id = :id
             AND t.availableSpots < t.capacity
           """)
    int releaseSpotAtomically(@Param("id") Long id);

    /**
     * Status of a trip within an organization, read without loading or locking the row.
     */
    @Query("SELECT t.status FROM Trip t WHERE t.id = :id AND t.organizationId = :organizationId")
    Optional<Trip.TripStatus> findStatusByIdAndOrganizationId(@Param("id") Long id,
                                                              @Param("organizationId") Long organizationId);

    List<Trip> findByOrganizationId(Long organizationId);

    @Query("""
           SELECT t FROM Trip t
           WHERE t.organizationId = :organizationId
             AND (:status IS NULL OR t.status = :status)
             AND (:tripType IS NULL OR t.tripType = :tripType)
             AND (:startFrom IS NULL OR t.startDate >= :startFrom)
             AND (:startTo IS NULL OR t.startDate <= :startTo)
           ORDER BY t.startDate ASC
           """)
    List<Trip> search(@Param("organizationId") Long organizationId,
                      @Param("status") Trip.TripStatus status,
                      @Param("tripType") Trip.TripType tripType,
                      @Param("startFrom") LocalDate startFrom,
                      @Param("startTo") LocalDate startTo);

    List<Trip> findByOrganizationIdAndStartDateAfterAndStatusNotOrderByStartDateAsc(
            Long organizationId, LocalDate date, Trip.TripStatus excludedStatus);

    List<Trip> findByOrganizationIdAndStatusOrderByStartDateAsc(Long organizationId, Trip.TripStatus status);
}
