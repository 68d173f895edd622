package com.opentrips.trip.domain.service;

import com.opentrips.common.exception.ResourceNotFoundException;
import com.opentrips.trip.api.dto.TripReportResponse;
import com.opentrips.trip.api.dto.TripStatisticsResponse;
import com.opentrips.trip.domain.model.Registration;
import com.opentrips.trip.domain.model.Trip;
import com.opentrips.trip.domain.repository.RegistrationRepository;
import com.opentrips.trip.domain.repository.TripRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-only rollups over trips and registrations. Takes no locks.
 */
@Service
@RequiredArgsConstructor
public class TripStatisticsService {

    private static final Set<Trip.TripStatus> ACTIVE_STATUSES =
            EnumSet.of(Trip.TripStatus.OPEN, Trip.TripStatus.CLOSED, Trip.TripStatus.FULL);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TripRepository tripRepository;
    private final RegistrationRepository registrationRepository;
    private final Clock clock;

    /**
     * Organization-wide counts and revenue. Revenue sums run over every registration,
     * cancelled ones included.
     */
    @Transactional(readOnly = true)
    public TripStatisticsResponse getStatistics(Long organizationId) {
        List<Trip> trips = tripRepository.findByOrganizationId(organizationId);
        List<Registration> registrations = registrationRepository.findByOrganizationId(organizationId);
        LocalDate today = LocalDate.now(clock);

        long activeTrips = trips.stream().filter(t -> ACTIVE_STATUSES.contains(t.getStatus())).count();
        long upcomingTrips = trips.stream()
                .filter(t -> t.getStartDate().isAfter(today))
                .filter(t -> t.getStatus() != Trip.TripStatus.CANCELLED)
                .count();
        long completedTrips = trips.stream().filter(t -> t.getStatus() == Trip.TripStatus.COMPLETED).count();
        long confirmed = registrations.stream()
                .filter(r -> r.getStatus() == Registration.RegistrationStatus.CONFIRMED)
                .count();

        return new TripStatisticsResponse(
                trips.size(),
                activeTrips,
                upcomingTrips,
                completedTrips,
                registrations.size(),
                confirmed,
                sum(registrations, Registration::getTotalAmount),
                sum(registrations, Registration::getAmountPaid),
                sum(registrations, Registration::getBalanceDue));
    }

    @Transactional(readOnly = true)
    public TripReportResponse getTripReport(Long tripId) {
        Trip trip = tripRepository.findById(tripId)
                .orElseThrow(() -> new ResourceNotFoundException("Trip", tripId));
        List<Registration> registrations = registrationRepository.findByTripId(tripId);
        List<Registration> live = registrations.stream().filter(r -> !r.isCancelled()).toList();

        BigDecimal expected = sum(live, Registration::getTotalAmount);
        BigDecimal collected = sum(live, Registration::getAmountPaid);
        BigDecimal pending = sum(live, Registration::getBalanceDue);
        BigDecimal collectionRate = expected.signum() == 0
                ? BigDecimal.ZERO
                : collected.multiply(HUNDRED).divide(expected, 2, RoundingMode.HALF_UP);

        return new TripReportResponse(
                trip.getId(),
                trip.getName(),
                trip.getCapacity(),
                trip.getAvailableSpots(),
                trip.reservedSpots(),
                countBy(registrations, Registration.RegistrationStatus.class, Registration::getStatus),
                countBy(live, Registration.PaymentStatus.class, Registration::getPaymentStatus),
                countBy(live, Registration.VisaStatus.class, Registration::getVisaStatus),
                countBy(live, Registration.RoomType.class, Registration::getRoomType),
                expected,
                collected,
                pending,
                collectionRate);
    }

    private static BigDecimal sum(List<Registration> registrations, Function<Registration, BigDecimal> field) {
        return registrations.stream()
                .map(field)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static <E extends Enum<E>> Map<E, Long> countBy(List<Registration> registrations, Class<E> type,
                                                            Function<Registration, E> field) {
        Map<E, Long> counts = new EnumMap<>(type);
        for (E value : type.getEnumConstants()) {
            counts.put(value, 0L);
        }
        for (Registration registration : registrations) {
            E value = field.apply(registration);
            if (value != null) {
                counts.merge(value, 1L, Long::sum);
            }
        }
        return counts;
    }
}
