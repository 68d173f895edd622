package com.opentrips.trip.domain.service;

import com.opentrips.common.exception.ResourceNotFoundException;
import com.opentrips.common.exception.ValidationException;
import com.opentrips.trip.api.dto.CreateTripRequest;
import com.opentrips.trip.api.dto.TripResponse;
import com.opentrips.trip.api.dto.UpdateTripRequest;
import com.opentrips.trip.domain.model.Trip;
import com.opentrips.trip.domain.repository.RegistrationRepository;
import com.opentrips.trip.domain.repository.TripRepository;
import com.opentrips.trip.exception.InvalidStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TripServiceTest {

    private static final Long ORG_ID = 1L;
    private static final Long TRIP_ID = 10L;

    @Mock
    private TripRepository tripRepository;

    @Mock
    private RegistrationRepository registrationRepository;

    private TripService tripService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);
        tripService = new TripService(tripRepository, registrationRepository, clock);
    }

    @Test
    @DisplayName("createTrip() starts with every seat available")
    void createTrip_availableSpotsEqualCapacity() {
        // given
        CreateTripRequest request = new CreateTripRequest("Spring Umrah", null, "UR2024", Trip.TripType.UMRAH,
                LocalDate.of(2026, 4, 1), LocalDate.of(2026, 4, 12), null, "Makkah",
                new BigDecimal("2500.00"), new BigDecimal("500.00"), "USD", 40, 5, Trip.TripStatus.OPEN,
                null, null);
        given(tripRepository.save(any(Trip.class))).willAnswer(inv -> inv.getArgument(0));

        // when
        TripResponse response = tripService.createTrip(ORG_ID, request);

        // then
        ArgumentCaptor<Trip> captor = ArgumentCaptor.forClass(Trip.class);
        verify(tripRepository).save(captor.capture());
        assertThat(captor.getValue().getAvailableSpots()).isEqualTo(40);
        assertThat(captor.getValue().getOrganizationId()).isEqualTo(ORG_ID);
        assertThat(response.capacity()).isEqualTo(40);
    }

    @Test
    @DisplayName("createTrip() rejects an end date before the start date")
    void createTrip_endBeforeStart() {
        CreateTripRequest request = new CreateTripRequest("Bad dates", null, null, null,
                LocalDate.of(2026, 4, 12), LocalDate.of(2026, 4, 1), null, null,
                null, null, null, 10, null, null, null, null);

        assertThatThrownBy(() -> tripService.createTrip(ORG_ID, request))
                .isInstanceOf(ValidationException.class);
        verify(tripRepository, never()).save(any());
    }

    @Test
    @DisplayName("createTrip() rejects a deposit larger than the price")
    void createTrip_depositAbovePrice() {
        CreateTripRequest request = new CreateTripRequest("Deposit", null, null, null,
                LocalDate.of(2026, 4, 1), LocalDate.of(2026, 4, 12), null, null,
                new BigDecimal("100"), new BigDecimal("150"), null, 10, null, null, null, null);

        assertThatThrownBy(() -> tripService.createTrip(ORG_ID, request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Deposit");
    }

    @Test
    @DisplayName("createTrip() rejects a price with more than two decimals")
    void createTrip_priceScale() {
        CreateTripRequest request = new CreateTripRequest("Scale", null, null, null,
                LocalDate.of(2026, 4, 1), LocalDate.of(2026, 4, 12), null, null,
                new BigDecimal("10.001"), null, null, 10, null, null, null, null);

        assertThatThrownBy(() -> tripService.createTrip(ORG_ID, request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Price");
        verify(tripRepository, never()).save(any());
    }

    @Test
    @DisplayName("updateTripStatus() writes through the locked row")
    void updateTripStatus_locksRow() {
        Trip trip = trip(10, 7);
        given(tripRepository.findByIdWithLock(TRIP_ID)).willReturn(Optional.of(trip));
        given(tripRepository.save(trip)).willReturn(trip);

        TripResponse response = tripService.updateTripStatus(TRIP_ID, Trip.TripStatus.CLOSED);

        assertThat(response.status()).isEqualTo(Trip.TripStatus.CLOSED);
        assertThat(trip.getAvailableSpots()).isEqualTo(7);
        verify(tripRepository, never()).findById(any());
    }

    @Test
    @DisplayName("updateTripStatus() on a missing trip throws NotFound")
    void updateTripStatus_missing() {
        given(tripRepository.findByIdWithLock(TRIP_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> tripService.updateTripStatus(TRIP_ID, Trip.TripStatus.OPEN))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(tripRepository, never()).save(any());
    }

    @Test
    @DisplayName("updateTrip() shifts available spots by the capacity difference")
    void updateTrip_capacityChangeKeepsReservedSeats() {
        // given: 10 seats, 4 taken
        Trip trip = trip(10, 6);
        given(tripRepository.findByIdWithLock(TRIP_ID)).willReturn(Optional.of(trip));
        given(tripRepository.save(trip)).willReturn(trip);

        // when
        TripResponse response = tripService.updateTrip(TRIP_ID, capacityUpdate(15));

        // then
        assertThat(response.capacity()).isEqualTo(15);
        assertThat(response.availableSpots()).isEqualTo(11);
    }

    @Test
    @DisplayName("updateTrip() refuses a capacity below the seats already reserved")
    void updateTrip_capacityBelowReserved() {
        Trip trip = trip(10, 6);
        given(tripRepository.findByIdWithLock(TRIP_ID)).willReturn(Optional.of(trip));

        assertThatThrownBy(() -> tripService.updateTrip(TRIP_ID, capacityUpdate(3)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("4 seats already reserved");
        assertThat(trip.getAvailableSpots()).isEqualTo(6);
    }

    @Test
    @DisplayName("updateTrip() on a missing trip throws NotFound")
    void updateTrip_missing() {
        given(tripRepository.findByIdWithLock(TRIP_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> tripService.updateTrip(TRIP_ID, capacityUpdate(5)))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("getUpcomingTrips() asks for trips starting after the clock's today")
    void getUpcomingTrips_usesClock() {
        given(tripRepository.findByOrganizationIdAndStartDateAfterAndStatusNotOrderByStartDateAsc(
                ORG_ID, LocalDate.of(2026, 3, 1), Trip.TripStatus.CANCELLED))
                .willReturn(List.of(trip(10, 10)));

        assertThat(tripService.getUpcomingTrips(ORG_ID)).hasSize(1);
    }

    @Test
    @DisplayName("deleteTrip() is refused once the trip has registrations")
    void deleteTrip_withRegistrations() {
        Trip trip = trip(10, 9);
        given(tripRepository.findByIdWithLock(TRIP_ID)).willReturn(Optional.of(trip));
        given(registrationRepository.countByTripId(TRIP_ID)).willReturn(1L);

        assertThatThrownBy(() -> tripService.deleteTrip(TRIP_ID))
                .isInstanceOf(InvalidStateException.class);
        verify(tripRepository, never()).delete(any());
    }

    @Test
    @DisplayName("deleteTrip() removes a trip nobody registered for")
    void deleteTrip_empty() {
        Trip trip = trip(10, 10);
        given(tripRepository.findByIdWithLock(TRIP_ID)).willReturn(Optional.of(trip));
        given(registrationRepository.countByTripId(TRIP_ID)).willReturn(0L);

        tripService.deleteTrip(TRIP_ID);

        verify(tripRepository).delete(trip);
    }

    private static Trip trip(int capacity, int available) {
        return Trip.builder()
                .id(TRIP_ID)
                .organizationId(ORG_ID)
                .name("Winter Ziyarat")
                .tripType(Trip.TripType.ZIYARAT)
                .startDate(LocalDate.of(2026, 12, 1))
                .endDate(LocalDate.of(2026, 12, 10))
                .currency("USD")
                .capacity(capacity)
                .availableSpots(available)
                .status(Trip.TripStatus.OPEN)
                .build();
    }

    private static UpdateTripRequest capacityUpdate(int capacity) {
        return new UpdateTripRequest(null, null, null, null, null, null, null, null,
                null, null, null, capacity, null, null, null);
    }
}
