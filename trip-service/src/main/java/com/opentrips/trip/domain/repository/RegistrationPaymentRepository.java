package com.opentrips.trip.domain.repository;

import com.opentrips.trip.domain.model.RegistrationPayment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RegistrationPaymentRepository extends JpaRepository<RegistrationPayment, Long> {

    List<RegistrationPayment> findByRegistrationIdOrderByRecordedAtAsc(Long registrationId);
}
