package com.opentrips.trip.api.controller;

import com.opentrips.common.dto.BaseResponse;
import com.opentrips.trip.api.dto.CreateTripRequest;
import com.opentrips.trip.api.dto.TripReportResponse;
import com.opentrips.trip.api.dto.TripResponse;
import com.opentrips.trip.api.dto.UpdateTripRequest;
import com.opentrips.trip.api.dto.UpdateTripStatusRequest;
import com.opentrips.trip.domain.model.Trip;
import com.opentrips.trip.domain.service.TripService;
import com.opentrips.trip.domain.service.TripStatisticsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for the trip catalogue.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class TripController {

    private final TripService tripService;
    private final TripStatisticsService statisticsService;

    @PostMapping("/organizations/{organizationId}/trips")
    public ResponseEntity<BaseResponse<TripResponse>> createTrip(
            @PathVariable Long organizationId,
            @Valid @RequestBody CreateTripRequest request) {
        TripResponse response = tripService.createTrip(organizationId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Trip created successfully", response));
    }

    @GetMapping("/organizations/{organizationId}/trips")
    public ResponseEntity<BaseResponse<List<TripResponse>>> getTrips(
            @PathVariable Long organizationId,
            @RequestParam(required = false) Trip.TripStatus status,
            @RequestParam(required = false) Trip.TripType tripType,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startTo) {
        List<TripResponse> response = tripService.getTrips(organizationId, status, tripType, startFrom, startTo);
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/organizations/{organizationId}/trips/upcoming")
    public ResponseEntity<BaseResponse<List<TripResponse>>> getUpcomingTrips(@PathVariable Long organizationId) {
        return ResponseEntity.ok(BaseResponse.success(tripService.getUpcomingTrips(organizationId)));
    }

    @GetMapping("/organizations/{organizationId}/trips/in-progress")
    public ResponseEntity<BaseResponse<List<TripResponse>>> getTripsInProgress(@PathVariable Long organizationId) {
        return ResponseEntity.ok(BaseResponse.success(tripService.getTripsInProgress(organizationId)));
    }

    @GetMapping("/trips/{tripId}")
    public ResponseEntity<BaseResponse<TripResponse>> getTrip(@PathVariable Long tripId) {
        return ResponseEntity.ok(BaseResponse.success(tripService.getTripById(tripId)));
    }

    @PutMapping("/trips/{tripId}")
    public ResponseEntity<BaseResponse<TripResponse>> updateTrip(
            @PathVariable Long tripId,
            @Valid @RequestBody UpdateTripRequest request) {
        TripResponse response = tripService.updateTrip(tripId, request);
        return ResponseEntity.ok(BaseResponse.success("Trip updated successfully", response));
    }

    @PatchMapping("/trips/{tripId}/status")
    public ResponseEntity<BaseResponse<TripResponse>> updateTripStatus(
            @PathVariable Long tripId,
            @Valid @RequestBody UpdateTripStatusRequest request) {
        TripResponse response = tripService.updateTripStatus(tripId, request.status());
        return ResponseEntity.ok(BaseResponse.success("Trip status updated", response));
    }

    @DeleteMapping("/trips/{tripId}")
    public ResponseEntity<BaseResponse<Void>> deleteTrip(@PathVariable Long tripId) {
        tripService.deleteTrip(tripId);
        return ResponseEntity.ok(BaseResponse.success("Trip deleted successfully", null));
    }

    @GetMapping("/trips/{tripId}/report")
    public ResponseEntity<BaseResponse<TripReportResponse>> getTripReport(@PathVariable Long tripId) {
        return ResponseEntity.ok(BaseResponse.success(statisticsService.getTripReport(tripId)));
    }
}
