package com.opentrips.trip.domain.service;

import com.opentrips.trip.domain.model.Registration;
import com.opentrips.trip.domain.model.Trip;
import com.opentrips.trip.domain.repository.RegistrationRepository;
import com.opentrips.trip.exception.InvalidStateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;

/**
 * Produces trip-scoped registration numbers of the form {@code PREFIX-YY-NNNN}.
 * <p>
 * PREFIX is the trip code (or {@code REG}), YY the current two-digit year and NNNN
 * a zero-padded counter per prefix and year, derived from the highest existing number.
 * <p>
 * Must run in the same transaction as the seat reservation: by then the trip row is
 * write-locked, so concurrent registrations on the trip queue up behind it. The
 * (trip_id, registration_number) unique constraint catches anything that slips through.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegistrationNumberGenerator {

    static final String DEFAULT_PREFIX = "REG";
    static final int MAX_SEQUENCE = 9999;

    private final RegistrationRepository registrationRepository;
    private final Clock clock;

    public String nextNumber(Trip trip) {
        String scope = scopeFor(trip.getCode());
        int last = registrationRepository
                .findFirstByTripIdAndRegistrationNumberStartingWithOrderByRegistrationNumberDesc(trip.getId(), scope)
                .map(Registration::getRegistrationNumber)
                .map(RegistrationNumberGenerator::parseSequence)
                .orElse(0);

        int next = last + 1;
        if (next > MAX_SEQUENCE) {
            throw new InvalidStateException(String.format(
                    "Registration numbers for %s on trip %d are exhausted", scope, trip.getId()));
        }
        String number = scope + String.format("%04d", next);
        log.debug("Generated registration number {} for trip {}", number, trip.getId());
        return number;
    }

    String scopeFor(String tripCode) {
        String prefix = tripCode == null || tripCode.isBlank() ? DEFAULT_PREFIX : tripCode.trim();
        int year = Year.now(clock).getValue() % 100;
        return String.format("%s-%02d-", prefix, year);
    }

    /**
     * Numeric tail after the last dash; anything unparseable counts as 0.
     */
    static int parseSequence(String registrationNumber) {
        String tail = registrationNumber.substring(registrationNumber.lastIndexOf('-') + 1);
        try {
            return Integer.parseInt(tail);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed registration number {}", registrationNumber);
            return 0;
        }
    }
}
