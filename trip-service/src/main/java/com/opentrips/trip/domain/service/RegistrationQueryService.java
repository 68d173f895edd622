package com.opentrips.trip.domain.service;

import com.opentrips.common.exception.ResourceNotFoundException;
import com.opentrips.trip.api.dto.PaymentResponse;
import com.opentrips.trip.api.dto.RegistrationResponse;
import com.opentrips.trip.domain.model.Member;
import com.opentrips.trip.domain.model.Registration;
import com.opentrips.trip.domain.model.Trip;
import com.opentrips.trip.domain.repository.MemberRepository;
import com.opentrips.trip.domain.repository.RegistrationPaymentRepository;
import com.opentrips.trip.domain.repository.RegistrationRepository;
import com.opentrips.trip.domain.repository.TripRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RegistrationQueryService {

    private final RegistrationRepository registrationRepository;
    private final RegistrationPaymentRepository paymentRepository;
    private final TripRepository tripRepository;
    private final MemberRepository memberRepository;

    public RegistrationResponse getRegistrationById(Long registrationId) {
        Registration registration = findRegistration(registrationId);
        Trip trip = tripRepository.findById(registration.getTripId()).orElse(null);
        Member member = memberRepository.findById(registration.getMemberId()).orElse(null);
        return RegistrationResponse.from(registration, trip, member);
    }

    public List<RegistrationResponse> getRegistrationsForTrip(Long tripId,
                                                              Registration.RegistrationStatus status,
                                                              Registration.PaymentStatus paymentStatus,
                                                              Registration.VisaStatus visaStatus) {
        Trip trip = tripRepository.findById(tripId)
                .orElseThrow(() -> new ResourceNotFoundException("Trip", tripId));
        List<Registration> registrations = registrationRepository.searchByTrip(tripId, status, paymentStatus, visaStatus);
        Map<Long, Member> members = membersOf(registrations);
        return registrations.stream()
                .map(r -> RegistrationResponse.from(r, trip, members.get(r.getMemberId())))
                .toList();
    }

    public List<RegistrationResponse> getRegistrationsByMember(Long memberId) {
        Member member = memberRepository.findById(memberId).orElse(null);
        List<Registration> registrations = registrationRepository.findByMemberIdOrderByCreatedAtDesc(memberId);
        Set<Long> tripIds = registrations.stream().map(Registration::getTripId).collect(Collectors.toSet());
        Map<Long, Trip> trips = tripRepository.findAllById(tripIds).stream()
                .collect(Collectors.toMap(Trip::getId, Function.identity()));
        return registrations.stream()
                .map(r -> RegistrationResponse.from(r, trips.get(r.getTripId()), member))
                .toList();
    }

    public List<PaymentResponse> getPayments(Long registrationId) {
        findRegistration(registrationId);
        return paymentRepository.findByRegistrationIdOrderByRecordedAtAsc(registrationId).stream()
                .map(PaymentResponse::from)
                .toList();
    }

    private Registration findRegistration(Long registrationId) {
        return registrationRepository.findById(registrationId)
                .orElseThrow(() -> new ResourceNotFoundException("Registration", registrationId));
    }

    private Map<Long, Member> membersOf(List<Registration> registrations) {
        Set<Long> memberIds = registrations.stream().map(Registration::getMemberId).collect(Collectors.toSet());
        return memberRepository.findAllById(memberIds).stream()
                .collect(Collectors.toMap(Member::getId, Function.identity()));
    }
}
