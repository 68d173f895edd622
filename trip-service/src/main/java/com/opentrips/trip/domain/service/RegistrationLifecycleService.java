package com.opentrips.trip.domain.service;

import com.opentrips.common.exception.ResourceNotFoundException;
import com.opentrips.common.exception.ValidationException;
import com.opentrips.common.util.MoneyAmounts;
import com.opentrips.trip.api.dto.CancelRegistrationRequest;
import com.opentrips.trip.api.dto.CreateRegistrationRequest;
import com.opentrips.trip.api.dto.RecordPaymentRequest;
import com.opentrips.trip.api.dto.RegistrationResponse;
import com.opentrips.trip.api.dto.UpdateVisaStatusRequest;
import com.opentrips.trip.domain.model.Member;
import com.opentrips.trip.domain.model.Registration;
import com.opentrips.trip.domain.model.Registration.PaymentStatus;
import com.opentrips.trip.domain.model.Registration.RegistrationStatus;
import com.opentrips.trip.domain.model.Registration.VisaStatus;
import com.opentrips.trip.domain.model.RegistrationPayment;
import com.opentrips.trip.domain.model.Trip;
import com.opentrips.trip.domain.repository.MemberRepository;
import com.opentrips.trip.domain.repository.RegistrationPaymentRepository;
import com.opentrips.trip.domain.repository.RegistrationRepository;
import com.opentrips.trip.domain.repository.TripRepository;
import com.opentrips.trip.events.RegistrationCancelledEvent;
import com.opentrips.trip.events.RegistrationConfirmedEvent;
import com.opentrips.trip.exception.ConcurrencyConflictException;
import com.opentrips.trip.exception.InvalidStateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Creates, pays, updates visa data of, and cancels registrations.
 * <p>
 * Every mutating operation is one database transaction, run through the registration
 * retry template: a transaction that loses a race (lock failure, stale version,
 * unique key taken by a concurrent insert) is rolled back and replayed from scratch.
 * Once the attempts are used up the caller gets {@link ConcurrencyConflictException}.
 * Other constraint violations are not races and propagate unchanged.
 * <p>
 * Creation reserves the seat first, so the trip row is write-locked by the time the
 * registration number is computed and the row is inserted.
 */
@Slf4j
@Service
public class RegistrationLifecycleService {

    /** PostgreSQL unique_violation. */
    private static final String UNIQUE_VIOLATION = "23505";

    private static final Set<Trip.TripStatus> CLOSED_FOR_REGISTRATION =
            EnumSet.of(Trip.TripStatus.CANCELLED, Trip.TripStatus.COMPLETED);

    private final TripRepository tripRepository;
    private final RegistrationRepository registrationRepository;
    private final RegistrationPaymentRepository paymentRepository;
    private final MemberRepository memberRepository;
    private final CapacityManager capacityManager;
    private final RegistrationNumberGenerator numberGenerator;
    private final BalanceCalculator balanceCalculator;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate retryTemplate;
    private final Clock clock;

    public RegistrationLifecycleService(TripRepository tripRepository,
                                        RegistrationRepository registrationRepository,
                                        RegistrationPaymentRepository paymentRepository,
                                        MemberRepository memberRepository,
                                        CapacityManager capacityManager,
                                        RegistrationNumberGenerator numberGenerator,
                                        BalanceCalculator balanceCalculator,
                                        ApplicationEventPublisher eventPublisher,
                                        TransactionTemplate transactionTemplate,
                                        @Qualifier("registrationRetryTemplate") RetryTemplate retryTemplate,
                                        Clock clock) {
        this.tripRepository = tripRepository;
        this.registrationRepository = registrationRepository;
        this.paymentRepository = paymentRepository;
        this.memberRepository = memberRepository;
        this.capacityManager = capacityManager;
        this.numberGenerator = numberGenerator;
        this.balanceCalculator = balanceCalculator;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = transactionTemplate;
        this.retryTemplate = retryTemplate;
        this.clock = clock;
    }

    /**
     * Books a member on a trip. When the trip is full nothing is persisted and
     * {@link com.opentrips.trip.exception.CapacityExhaustedException} is thrown.
     */
    public RegistrationResponse createRegistration(Long organizationId, CreateRegistrationRequest request) {
        if (request.totalAmount() != null && request.totalAmount().signum() < 0) {
            throw new ValidationException("Total amount cannot be negative");
        }
        MoneyAmounts.requireStorable("Total amount", request.totalAmount());
        return executeAtomically("create registration", () -> doCreateRegistration(organizationId, request));
    }

    /**
     * Adds a payment. Any payment confirms a pending registration; trip capacity is untouched.
     */
    public RegistrationResponse recordPayment(Long registrationId, RecordPaymentRequest request) {
        if (request.amount() == null || request.amount().signum() <= 0) {
            throw new ValidationException("Payment amount must be greater than zero");
        }
        MoneyAmounts.requireStorable("Payment amount", request.amount());
        return executeAtomically("record payment", () -> doRecordPayment(registrationId, request));
    }

    public RegistrationResponse updateVisaStatus(Long registrationId, UpdateVisaStatusRequest request) {
        if (request.visaIssueDate() != null && request.visaExpiryDate() != null
                && request.visaExpiryDate().isBefore(request.visaIssueDate())) {
            throw new ValidationException("Visa expiry date cannot be before issue date");
        }
        return executeAtomically("update visa status", () -> doUpdateVisaStatus(registrationId, request));
    }

    /**
     * Cancels a registration and gives its seat back. Cancelling twice is an
     * {@link InvalidStateException}; the seat is released only once.
     */
    public RegistrationResponse cancelRegistration(Long registrationId, CancelRegistrationRequest request) {
        if (request.refundAmount() != null && request.refundAmount().signum() < 0) {
            throw new ValidationException("Refund amount cannot be negative");
        }
        MoneyAmounts.requireStorable("Refund amount", request.refundAmount());
        return executeAtomically("cancel registration", () -> doCancelRegistration(registrationId, request));
    }

    private RegistrationResponse doCreateRegistration(Long organizationId, CreateRegistrationRequest request) {
        Long tripId = request.tripId();
        // status only: the trip row is read by the capacity strategy under its own locking
        Trip.TripStatus tripStatus = tripRepository.findStatusByIdAndOrganizationId(tripId, organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("Trip", tripId));
        requireOpenForRegistration(tripId, tripStatus);
        Member member = memberRepository.findByIdAndOrganizationId(request.memberId(), organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("Member", request.memberId()));

        if (registrationRepository.existsByTripIdAndMemberIdAndStatusNot(
                tripId, member.getId(), RegistrationStatus.CANCELLED)) {
            throw new InvalidStateException(String.format(
                    "Member %d already has an active registration on trip %d", member.getId(), tripId));
        }

        Trip trip = capacityManager.reserveSpot(tripId);
        // the status may have changed before the seat was taken
        requireOpenForRegistration(tripId, trip.getStatus());

        BigDecimal totalAmount = request.totalAmount() != null ? request.totalAmount() : trip.priceOrZero();
        String registrationNumber = numberGenerator.nextNumber(trip);

        Registration registration = Registration.builder()
                .organizationId(organizationId)
                .tripId(tripId)
                .memberId(member.getId())
                .registrationNumber(registrationNumber)
                .registrationDate(LocalDate.now(clock))
                .status(RegistrationStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .totalAmount(totalAmount)
                .amountPaid(BigDecimal.ZERO)
                .depositPaid(BigDecimal.ZERO)
                .balanceDue(totalAmount)
                .currency(trip.getCurrency())
                .roomType(request.roomType())
                .passportNumber(request.passportNumber())
                .passportExpiry(request.passportExpiry())
                .passportCountry(request.passportCountry())
                .visaStatus(VisaStatus.NOT_STARTED)
                .specialRequests(request.specialRequests())
                .notes(request.notes())
                .build();

        // flush now so a duplicate number fails inside the retried unit
        Registration saved = registrationRepository.saveAndFlush(registration);
        log.info("Created registration {} ({}) on trip {}, {} spots left",
                saved.getId(), registrationNumber, tripId, trip.getAvailableSpots());
        return RegistrationResponse.from(saved, trip, member);
    }

    private RegistrationResponse doRecordPayment(Long registrationId, RecordPaymentRequest request) {
        Registration registration = lockRegistration(registrationId);
        if (registration.isCancelled()) {
            throw new InvalidStateException(String.format(
                    "Registration %s is cancelled and cannot take payments", registration.getRegistrationNumber()));
        }
        Trip trip = tripRepository.findById(registration.getTripId())
                .orElseThrow(() -> new ResourceNotFoundException("Trip", registration.getTripId()));

        BigDecimal amountPaid = registration.getAmountPaid().add(request.amount());
        PaymentStatus previousPaymentStatus = registration.getPaymentStatus();
        registration.setAmountPaid(amountPaid);
        registration.setBalanceDue(balanceCalculator.balanceDue(registration.getTotalAmount(), amountPaid));
        registration.setDepositPaid(balanceCalculator.depositPaid(amountPaid, trip.getDepositAmount()));
        registration.setPaymentStatus(balanceCalculator.paymentStatus(
                registration.getTotalAmount(), amountPaid, trip.getDepositAmount(), previousPaymentStatus));

        boolean confirmed = registration.getStatus() == RegistrationStatus.PENDING;
        if (confirmed) {
            registration.setStatus(RegistrationStatus.CONFIRMED);
        }
        Registration saved = registrationRepository.save(registration);

        paymentRepository.save(RegistrationPayment.builder()
                .registrationId(saved.getId())
                .amount(request.amount())
                .paymentMethod(request.paymentMethod())
                .referenceNumber(request.referenceNumber())
                .notes(request.notes())
                .recordedAt(LocalDateTime.now(clock))
                .build());

        log.info("Recorded payment of {} on registration {}: payment status {} -> {}, balance due {}",
                request.amount(), saved.getRegistrationNumber(), previousPaymentStatus,
                saved.getPaymentStatus(), saved.getBalanceDue());
        if (confirmed) {
            eventPublisher.publishEvent(RegistrationConfirmedEvent.of(saved, clock.instant()));
        }
        return RegistrationResponse.from(saved, trip, findMember(saved));
    }

    private RegistrationResponse doUpdateVisaStatus(Long registrationId, UpdateVisaStatusRequest request) {
        Registration registration = lockRegistration(registrationId);
        VisaStatus previous = registration.getVisaStatus();

        registration.setVisaStatus(request.visaStatus());
        if (request.visaNumber() != null) {
            registration.setVisaNumber(request.visaNumber());
        }
        if (request.visaIssueDate() != null) {
            registration.setVisaIssueDate(request.visaIssueDate());
        }
        if (request.visaExpiryDate() != null) {
            registration.setVisaExpiryDate(request.visaExpiryDate());
        }
        if (request.visaNotes() != null) {
            registration.setVisaNotes(request.visaNotes());
        }
        Registration saved = registrationRepository.save(registration);
        log.info("Visa status of registration {}: {} -> {}",
                saved.getRegistrationNumber(), previous, saved.getVisaStatus());
        return RegistrationResponse.from(saved, tripRepository.findById(saved.getTripId()).orElse(null),
                findMember(saved));
    }

    private RegistrationResponse doCancelRegistration(Long registrationId, CancelRegistrationRequest request) {
        Registration registration = lockRegistration(registrationId);
        if (registration.isCancelled()) {
            throw new InvalidStateException(String.format(
                    "Registration %s is already cancelled", registration.getRegistrationNumber()));
        }
        BigDecimal refund = request.refundAmount();
        if (refund != null && refund.compareTo(registration.getAmountPaid()) > 0) {
            throw new ValidationException(String.format(
                    "Refund %s exceeds amount paid %s", refund, registration.getAmountPaid()));
        }

        boolean seatReleased = registration.holdsSeat();
        Trip trip = seatReleased
                ? capacityManager.releaseSpot(registration.getTripId())
                : tripRepository.findById(registration.getTripId()).orElse(null);

        registration.cancel(request.reason(), refund, LocalDateTime.now(clock));
        // the capacity strategy may have cleared the persistence context; save merges if needed
        Registration saved = registrationRepository.save(registration);

        log.info("Cancelled registration {} on trip {} (seat released: {}, refund: {})",
                saved.getRegistrationNumber(), saved.getTripId(), seatReleased, refund);
        eventPublisher.publishEvent(RegistrationCancelledEvent.of(saved, seatReleased, clock.instant()));
        return RegistrationResponse.from(saved, trip, findMember(saved));
    }

    private static void requireOpenForRegistration(Long tripId, Trip.TripStatus status) {
        if (CLOSED_FOR_REGISTRATION.contains(status)) {
            throw new InvalidStateException(String.format(
                    "Trip %d is %s and does not accept registrations", tripId, status));
        }
    }

    private Registration lockRegistration(Long registrationId) {
        return registrationRepository.findByIdWithLock(registrationId)
                .orElseThrow(() -> new ResourceNotFoundException("Registration", registrationId));
    }

    private Member findMember(Registration registration) {
        return memberRepository.findById(registration.getMemberId()).orElse(null);
    }

    /**
     * Runs the work in a fresh transaction, replaying it when it loses a race.
     */
    private <T> T executeAtomically(String operation, Supplier<T> work) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("Retrying {} (attempt {}) after: {}", operation, context.getRetryCount() + 1,
                            context.getLastThrowable() != null ? context.getLastThrowable().getMessage() : "-");
                }
                try {
                    return transactionTemplate.execute(status -> work.get());
                } catch (DataIntegrityViolationException ex) {
                    if (!(ex instanceof DuplicateKeyException) && isUniqueViolation(ex)) {
                        throw new DuplicateKeyException(ex.getMessage(), ex);
                    }
                    throw ex;
                }
            });
        } catch (ConcurrencyFailureException | DuplicateKeyException ex) {
            log.warn("Giving up on {} after concurrent update conflicts: {}", operation, ex.getMessage());
            throw new ConcurrencyConflictException(
                    String.format("Could not %s because of concurrent updates, please retry", operation), ex);
        }
    }

    /**
     * JPA reports every constraint failure as a plain {@link DataIntegrityViolationException};
     * only a unique violation means a concurrent insert won.
     */
    private static boolean isUniqueViolation(Throwable ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sqlException && UNIQUE_VIOLATION.equals(sqlException.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
