package com.opentrips.trip.domain.service;

import com.opentrips.common.exception.ResourceNotFoundException;
import com.opentrips.common.exception.ValidationException;
import com.opentrips.common.util.MoneyAmounts;
import com.opentrips.trip.api.dto.CreateTripRequest;
import com.opentrips.trip.api.dto.TripResponse;
import com.opentrips.trip.api.dto.UpdateTripRequest;
import com.opentrips.trip.domain.model.Trip;
import com.opentrips.trip.domain.repository.RegistrationRepository;
import com.opentrips.trip.domain.repository.TripRepository;
import com.opentrips.trip.exception.InvalidStateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Trip catalogue of an organization.
 * Seat counts are only written here when a trip is created or its capacity is changed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripService {

    private final TripRepository tripRepository;
    private final RegistrationRepository registrationRepository;
    private final Clock clock;

    @Transactional
    public TripResponse createTrip(Long organizationId, CreateTripRequest request) {
        validateDates(request.startDate(), request.endDate());
        validateDeposit(request.price(), request.depositAmount());

        Trip trip = Trip.builder()
                .organizationId(organizationId)
                .name(request.name())
                .description(request.description())
                .code(request.code())
                .tripType(request.tripType())
                .startDate(request.startDate())
                .endDate(request.endDate())
                .registrationDeadline(request.registrationDeadline())
                .destination(request.destination())
                .price(request.price())
                .depositAmount(request.depositAmount())
                .currency(request.currency())
                .capacity(request.capacity())
                .availableSpots(request.capacity())
                .waitlistCapacity(request.waitlistCapacity())
                .status(request.status())
                .groupLeaderId(request.groupLeaderId())
                .notes(request.notes())
                .build();

        Trip saved = tripRepository.save(trip);
        log.info("Created trip {} ({}) for organization {} with capacity {}",
                saved.getId(), saved.getName(), organizationId, saved.getCapacity());
        return TripResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<TripResponse> getTrips(Long organizationId, Trip.TripStatus status, Trip.TripType tripType,
                                       LocalDate startFrom, LocalDate startTo) {
        return tripRepository.search(organizationId, status, tripType, startFrom, startTo).stream()
                .map(TripResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public TripResponse getTripById(Long tripId) {
        return TripResponse.from(findTrip(tripId));
    }

    /**
     * Trips starting after today that are not cancelled, soonest first.
     */
    @Transactional(readOnly = true)
    public List<TripResponse> getUpcomingTrips(Long organizationId) {
        return tripRepository.findByOrganizationIdAndStartDateAfterAndStatusNotOrderByStartDateAsc(
                        organizationId, LocalDate.now(clock), Trip.TripStatus.CANCELLED).stream()
                .map(TripResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<TripResponse> getTripsInProgress(Long organizationId) {
        return tripRepository.findByOrganizationIdAndStatusOrderByStartDateAsc(
                        organizationId, Trip.TripStatus.IN_PROGRESS).stream()
                .map(TripResponse::from)
                .toList();
    }

    /**
     * Partial update. A capacity change keeps the seats already taken:
     * the new capacity may not drop below them, and available spots shift by the difference.
     */
    @Transactional
    public TripResponse updateTrip(Long tripId, UpdateTripRequest request) {
        Trip trip = lockTrip(tripId);

        if (request.name() != null) trip.setName(request.name());
        if (request.description() != null) trip.setDescription(request.description());
        if (request.code() != null) trip.setCode(request.code());
        if (request.tripType() != null) trip.setTripType(request.tripType());
        if (request.startDate() != null) trip.setStartDate(request.startDate());
        if (request.endDate() != null) trip.setEndDate(request.endDate());
        if (request.registrationDeadline() != null) trip.setRegistrationDeadline(request.registrationDeadline());
        if (request.destination() != null) trip.setDestination(request.destination());
        if (request.price() != null) trip.setPrice(request.price());
        if (request.depositAmount() != null) trip.setDepositAmount(request.depositAmount());
        if (request.currency() != null) trip.setCurrency(request.currency());
        if (request.waitlistCapacity() != null) trip.setWaitlistCapacity(request.waitlistCapacity());
        if (request.groupLeaderId() != null) trip.setGroupLeaderId(request.groupLeaderId());
        if (request.notes() != null) trip.setNotes(request.notes());

        if (request.capacity() != null && !request.capacity().equals(trip.getCapacity())) {
            int reserved = trip.reservedSpots();
            if (request.capacity() < reserved) {
                throw new ValidationException(String.format(
                        "Capacity %d is below the %d seats already reserved", request.capacity(), reserved));
            }
            log.info("Changing capacity of trip {} from {} to {} ({} reserved)",
                    tripId, trip.getCapacity(), request.capacity(), reserved);
            trip.setCapacity(request.capacity());
            trip.setAvailableSpots(request.capacity() - reserved);
        }

        validateDates(trip.getStartDate(), trip.getEndDate());
        validateDeposit(trip.getPrice(), trip.getDepositAmount());
        return TripResponse.from(tripRepository.save(trip));
    }

    /**
     * Locks the row so the write cannot race a seat change on the same trip.
     */
    @Transactional
    public TripResponse updateTripStatus(Long tripId, Trip.TripStatus status) {
        Trip trip = lockTrip(tripId);
        Trip.TripStatus previous = trip.getStatus();
        trip.setStatus(status);
        Trip saved = tripRepository.save(trip);
        log.info("Trip {} status {} -> {}", tripId, previous, status);
        return TripResponse.from(saved);
    }

    /**
     * Only trips without any registration can be deleted; registrations are never removed.
     */
    @Transactional
    public void deleteTrip(Long tripId) {
        // locked so no registration can be inserted between the count and the delete
        Trip trip = lockTrip(tripId);
        long registrations = registrationRepository.countByTripId(tripId);
        if (registrations > 0) {
            throw new InvalidStateException(String.format(
                    "Trip %d has %d registrations and cannot be deleted; cancel it instead", tripId, registrations));
        }
        tripRepository.delete(trip);
        log.info("Deleted trip {}", tripId);
    }

    private Trip findTrip(Long tripId) {
        return tripRepository.findById(tripId)
                .orElseThrow(() -> new ResourceNotFoundException("Trip", tripId));
    }

    private Trip lockTrip(Long tripId) {
        return tripRepository.findByIdWithLock(tripId)
                .orElseThrow(() -> new ResourceNotFoundException("Trip", tripId));
    }

    private void validateDates(LocalDate startDate, LocalDate endDate) {
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new ValidationException("End date cannot be before start date");
        }
    }

    private void validateDeposit(BigDecimal price, BigDecimal depositAmount) {
        MoneyAmounts.requireStorable("Price", price);
        MoneyAmounts.requireStorable("Deposit amount", depositAmount);
        if (depositAmount == null) {
            return;
        }
        BigDecimal effectivePrice = price != null ? price : BigDecimal.ZERO;
        if (depositAmount.compareTo(effectivePrice) > 0) {
            throw new ValidationException("Deposit amount cannot exceed the trip price");
        }
    }
}
