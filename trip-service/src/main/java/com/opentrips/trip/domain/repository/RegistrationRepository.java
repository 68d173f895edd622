package com.opentrips.trip.domain.repository;

import com.opentrips.trip.domain.model.Registration;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RegistrationRepository extends JpaRepository<Registration, Long> {

    /**
     * Row lock for read-modify-write of a single registration (payments, visa, cancel).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Registration r WHERE r.id = :id")
    Optional<Registration> findByIdWithLock(@Param("id") Long id);

    /**
     * Highest registration number on the trip with the given prefix.
     * Numbers are fixed width, so lexicographic order is numeric order.
     */
    Optional<Registration> findFirstByTripIdAndRegistrationNumberStartingWithOrderByRegistrationNumberDesc(
            Long tripId, String numberPrefix);

    boolean existsByTripIdAndMemberIdAndStatusNot(Long tripId, Long memberId,
                                                 Registration.RegistrationStatus status);

    long countByTripId(Long tripId);

    List<Registration> findByOrganizationId(Long organizationId);

    List<Registration> findByTripId(Long tripId);

    List<Registration> findByMemberIdOrderByCreatedAtDesc(Long memberId);

    @Query("""
           SELECT r FROM Registration r
           WHERE r.tripId = :tripId
             AND (:status IS NULL OR r.status = :status)
             AND (:paymentStatus IS NULL OR r.paymentStatus = :paymentStatus)
             AND (:visaStatus IS NULL OR r.visaStatus = :visaStatus)
           ORDER BY r.registrationNumber ASC
           """)
    List<Registration> searchByTrip(@Param("tripId") Long tripId,
                                    @Param("status") Registration.RegistrationStatus status,
                                    @Param("paymentStatus") Registration.PaymentStatus paymentStatus,
                                    @Param("visaStatus") Registration.VisaStatus visaStatus);
}
