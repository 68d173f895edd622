package com.opentrips.trip.api.controller;

import com.opentrips.common.dto.BaseResponse;
import com.opentrips.trip.api.dto.CancelRegistrationRequest;
import com.opentrips.trip.api.dto.CreateRegistrationRequest;
import com.opentrips.trip.api.dto.PaymentResponse;
import com.opentrips.trip.api.dto.RecordPaymentRequest;
import com.opentrips.trip.api.dto.RegistrationResponse;
import com.opentrips.trip.api.dto.UpdateVisaStatusRequest;
import com.opentrips.trip.domain.model.Registration;
import com.opentrips.trip.domain.service.RegistrationLifecycleService;
import com.opentrips.trip.domain.service.RegistrationQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the registration lifecycle.
 * Full trips and repeated cancellations come back as 409 with distinct error codes.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RegistrationController {

    private final RegistrationLifecycleService lifecycleService;
    private final RegistrationQueryService queryService;

    @PostMapping("/organizations/{organizationId}/registrations")
    public ResponseEntity<BaseResponse<RegistrationResponse>> createRegistration(
            @PathVariable Long organizationId,
            @Valid @RequestBody CreateRegistrationRequest request) {
        RegistrationResponse response = lifecycleService.createRegistration(organizationId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Registration created successfully", response));
    }

    @GetMapping("/registrations/{registrationId}")
    public ResponseEntity<BaseResponse<RegistrationResponse>> getRegistration(@PathVariable Long registrationId) {
        return ResponseEntity.ok(BaseResponse.success(queryService.getRegistrationById(registrationId)));
    }

    @GetMapping("/trips/{tripId}/registrations")
    public ResponseEntity<BaseResponse<List<RegistrationResponse>>> getRegistrationsForTrip(
            @PathVariable Long tripId,
            @RequestParam(required = false) Registration.RegistrationStatus status,
            @RequestParam(required = false) Registration.PaymentStatus paymentStatus,
            @RequestParam(required = false) Registration.VisaStatus visaStatus) {
        List<RegistrationResponse> response =
                queryService.getRegistrationsForTrip(tripId, status, paymentStatus, visaStatus);
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/members/{memberId}/registrations")
    public ResponseEntity<BaseResponse<List<RegistrationResponse>>> getRegistrationsByMember(
            @PathVariable Long memberId) {
        return ResponseEntity.ok(BaseResponse.success(queryService.getRegistrationsByMember(memberId)));
    }

    @PostMapping("/registrations/{registrationId}/payments")
    public ResponseEntity<BaseResponse<RegistrationResponse>> recordPayment(
            @PathVariable Long registrationId,
            @Valid @RequestBody RecordPaymentRequest request) {
        RegistrationResponse response = lifecycleService.recordPayment(registrationId, request);
        return ResponseEntity.ok(BaseResponse.success("Payment recorded", response));
    }

    @GetMapping("/registrations/{registrationId}/payments")
    public ResponseEntity<BaseResponse<List<PaymentResponse>>> getPayments(@PathVariable Long registrationId) {
        return ResponseEntity.ok(BaseResponse.success(queryService.getPayments(registrationId)));
    }

    @PutMapping("/registrations/{registrationId}/visa")
    public ResponseEntity<BaseResponse<RegistrationResponse>> updateVisaStatus(
            @PathVariable Long registrationId,
            @Valid @RequestBody UpdateVisaStatusRequest request) {
        RegistrationResponse response = lifecycleService.updateVisaStatus(registrationId, request);
        return ResponseEntity.ok(BaseResponse.success("Visa status updated", response));
    }

    @PostMapping("/registrations/{registrationId}/cancel")
    public ResponseEntity<BaseResponse<RegistrationResponse>> cancelRegistration(
            @PathVariable Long registrationId,
            @Valid @RequestBody CancelRegistrationRequest request) {
        RegistrationResponse response = lifecycleService.cancelRegistration(registrationId, request);
        return ResponseEntity.ok(BaseResponse.success("Registration cancelled", response));
    }
}
