package com.opentrips.trip.domain.service;

import com.opentrips.trip.domain.model.Trip;
import com.opentrips.trip.domain.strategy.CapacityStrategy;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Single entry point for seat changes on a trip.
 * <p>
 * Spring injects every {@link CapacityStrategy} bean into the map, keyed by bean name
 * (pessimistic, optimistic, atomic). The active one is picked by
 * {@code trip.capacity.strategy}; unknown values fall back to pessimistic.
 * <p>
 * Both operations must be called inside the registration transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CapacityManager {

    static final String DEFAULT_STRATEGY = "pessimistic";

    private final Map<String, CapacityStrategy> capacityStrategies;

    @Value("${trip.capacity.strategy:pessimistic}")
    private String strategyType;

    @PostConstruct
    public void init() {
        log.info("Initialized CapacityManager with strategy: {}", getCapacityStrategy().getStrategyType());
    }

    public Trip reserveSpot(Long tripId) {
        CapacityStrategy strategy = getCapacityStrategy();
        log.debug("Reserving spot on trip {} using strategy: {}", tripId, strategy.getStrategyType());
        return strategy.reserve(tripId);
    }

    public Trip releaseSpot(Long tripId) {
        CapacityStrategy strategy = getCapacityStrategy();
        log.debug("Releasing spot on trip {} using strategy: {}", tripId, strategy.getStrategyType());
        return strategy.release(tripId);
    }

    private CapacityStrategy getCapacityStrategy() {
        String strategyKey = strategyType == null ? DEFAULT_STRATEGY : strategyType.trim().toLowerCase();
        CapacityStrategy strategy = capacityStrategies.get(strategyKey);

        if (strategy == null) {
            log.warn("Unknown capacity strategy: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, capacityStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = capacityStrategies.get(DEFAULT_STRATEGY);

            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " strategy not found. Available strategies: "
                                + capacityStrategies.keySet());
            }
        }
        return strategy;
    }
}
