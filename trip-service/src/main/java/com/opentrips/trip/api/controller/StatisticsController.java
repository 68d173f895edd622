package com.opentrips.trip.api.controller;

import com.opentrips.common.dto.BaseResponse;
import com.opentrips.trip.api.dto.TripStatisticsResponse;
import com.opentrips.trip.domain.service.TripStatisticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/organizations/{organizationId}/trip-statistics")
@RequiredArgsConstructor
public class StatisticsController {

    private final TripStatisticsService statisticsService;

    @GetMapping
    public ResponseEntity<BaseResponse<TripStatisticsResponse>> getStatistics(@PathVariable Long organizationId) {
        return ResponseEntity.ok(BaseResponse.success(statisticsService.getStatistics(organizationId)));
    }
}
