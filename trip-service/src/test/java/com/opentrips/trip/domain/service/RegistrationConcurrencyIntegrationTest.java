package com.opentrips.trip.domain.service;

import com.opentrips.trip.api.dto.CancelRegistrationRequest;
import com.opentrips.trip.api.dto.CreateRegistrationRequest;
import com.opentrips.trip.api.dto.RegistrationResponse;
import com.opentrips.trip.domain.model.Trip;
import com.opentrips.trip.domain.repository.TripRepository;
import com.opentrips.trip.exception.CapacityExhaustedException;
import com.opentrips.trip.exception.ConcurrencyConflictException;
import com.opentrips.trip.exception.InvalidStateException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.util.ReflectionTestUtils;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Races registrations for the same trip against a real PostgreSQL, once per capacity strategy.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class RegistrationConcurrencyIntegrationTest {

    private static final Long ORG_ID = 1L;
    private static final int CAPACITY = 5;
    private static final int CONTENDERS = 8;

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("trip_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    private RegistrationLifecycleService lifecycleService;

    @Autowired
    private CapacityManager capacityManager;

    @Autowired
    private TripRepository tripRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE registration_payments, registrations, trips, members RESTART IDENTITY CASCADE");
        for (long memberId = 1; memberId <= CONTENDERS; memberId++) {
            jdbcTemplate.update(
                    "INSERT INTO members (id, organization_id, first_name, last_name) VALUES (?, ?, ?, ?)",
                    memberId, ORG_ID, "Member", String.valueOf(memberId));
        }
        executor = Executors.newFixedThreadPool(CONTENDERS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(10, TimeUnit.SECONDS);
        ReflectionTestUtils.setField(capacityManager, "strategyType", "pessimistic");
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"pessimistic", "optimistic", "atomic"})
    @DisplayName("concurrent registrations never oversell and never share a number")
    void concurrentRegistrations_neverOversell(String strategy) throws Exception {
        // given
        ReflectionTestUtils.setField(capacityManager, "strategyType", strategy);
        Trip trip = tripRepository.save(trip());
        CountDownLatch start = new CountDownLatch(1);
        Set<String> numbers = ConcurrentHashMap.newKeySet();
        AtomicInteger full = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();

        List<Future<?>> futures = new ArrayList<>();
        for (long memberId = 1; memberId <= CONTENDERS; memberId++) {
            CreateRegistrationRequest request = new CreateRegistrationRequest(
                    trip.getId(), memberId, null, null, null, null, null, null, null);
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    RegistrationResponse response = lifecycleService.createRegistration(ORG_ID, request);
                    numbers.add(response.registrationNumber());
                } catch (CapacityExhaustedException e) {
                    full.incrementAndGet();
                } catch (ConcurrencyConflictException e) {
                    conflicts.incrementAndGet();
                }
                return null;
            }));
        }

        // when
        start.countDown();
        awaitAll(futures);

        // then
        Trip reloaded = tripRepository.findById(trip.getId()).orElseThrow();
        int successes = numbers.size();
        assertThat(successes + full.get() + conflicts.get()).isEqualTo(CONTENDERS);
        assertThat(successes).isLessThanOrEqualTo(CAPACITY);
        assertThat(reloaded.getAvailableSpots()).isEqualTo(CAPACITY - successes);
        assertThat(countRegistrations(trip.getId())).isEqualTo(successes);
        assertThat(numbers).allMatch(n -> n.matches("RACE-\\d{2}-\\d{4}"));
        if (!strategy.equals("optimistic")) {
            assertThat(successes).isEqualTo(CAPACITY);
            assertThat(full.get()).isEqualTo(CONTENDERS - CAPACITY);
        }
    }

    @Test
    @DisplayName("two concurrent cancels of one registration give back exactly one seat")
    void concurrentCancels_releaseOnce() throws Exception {
        Trip trip = tripRepository.save(trip());
        RegistrationResponse registration = lifecycleService.createRegistration(ORG_ID,
                new CreateRegistrationRequest(trip.getId(), 1L, null, null, null, null, null, null, null));
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger rejected = new AtomicInteger();

        Callable<Void> cancel = () -> {
            start.await();
            try {
                lifecycleService.cancelRegistration(registration.id(),
                        new CancelRegistrationRequest("changed plans", null));
            } catch (InvalidStateException e) {
                rejected.incrementAndGet();
            }
            return null;
        };
        List<Future<?>> futures = List.of(executor.submit(cancel), executor.submit(cancel));

        start.countDown();
        awaitAll(futures);

        assertThat(rejected.get()).isEqualTo(1);
        assertThat(tripRepository.findById(trip.getId()).orElseThrow().getAvailableSpots()).isEqualTo(CAPACITY);
    }

    private int countRegistrations(Long tripId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM registrations WHERE trip_id = ?", Integer.class, tripId);
        return count == null ? 0 : count;
    }

    private static void awaitAll(List<Future<?>> futures) throws InterruptedException, ExecutionException {
        for (Future<?> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                throw new AssertionError("registration did not finish in time", e);
            }
        }
    }

    private static Trip trip() {
        return Trip.builder()
                .organizationId(ORG_ID)
                .name("Race trip")
                .code("RACE")
                .tripType(Trip.TripType.UMRAH)
                .startDate(LocalDate.now().plusMonths(2))
                .endDate(LocalDate.now().plusMonths(2).plusDays(10))
                .price(new BigDecimal("1200.00"))
                .depositAmount(new BigDecimal("300.00"))
                .currency("USD")
                .capacity(CAPACITY)
                .availableSpots(CAPACITY)
                .waitlistCapacity(0)
                .status(Trip.TripStatus.OPEN)
                .build();
    }
}
