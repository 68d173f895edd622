package com.opentrips.trip.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One bookable group-travel program with a fixed number of seats.
 * <p>
 * {@code availableSpots} is owned by the capacity strategies; nothing else
 * should write it after creation. {@code @Version} lets the optimistic strategy
 * detect concurrent seat changes.
 */
@Entity
@Table(name = "trips", indexes = {
        @Index(name = "idx_trips_organization", columnList = "organization_id"),
        @Index(name = "idx_trips_status", columnList = "status"),
        @Index(name = "idx_trips_start_date", columnList = "start_date")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trip {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description")
    private String description;

    @Column(name = "code", length = 20)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(name = "trip_type", nullable = false, length = 20)
    private TripType tripType;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "registration_deadline")
    private LocalDate registrationDeadline;

    @Column(name = "destination")
    private String destination;

    @Column(name = "price", precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "deposit_amount", precision = 12, scale = 2)
    private BigDecimal depositAmount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "capacity", nullable = false)
    private Integer capacity;

    @Column(name = "available_spots", nullable = false)
    private Integer availableSpots;

    @Column(name = "waitlist_capacity", nullable = false)
    private Integer waitlistCapacity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TripStatus status;

    @Column(name = "group_leader_id")
    private Long groupLeaderId;

    @Column(name = "notes")
    private String notes;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null) {
            status = TripStatus.DRAFT;
        }
        if (tripType == null) {
            tripType = TripType.UMRAH;
        }
        if (currency == null) {
            currency = "USD";
        }
        if (waitlistCapacity == null) {
            waitlistCapacity = 10;
        }
        if (availableSpots == null) {
            availableSpots = capacity;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean hasAvailableSpot() {
        return availableSpots != null && availableSpots > 0;
    }

    /**
     * Takes one seat. Callers must hold the row lock or rely on the version check.
     */
    public void reserveSpot() {
        if (!hasAvailableSpot()) {
            throw new IllegalStateException("No available spots on trip " + id);
        }
        this.availableSpots -= 1;
    }

    /**
     * Gives one seat back, never going above capacity.
     */
    public void releaseSpot() {
        this.availableSpots = Math.min(capacity, availableSpots + 1);
    }

    /**
     * Seats currently held by registrations.
     */
    public int reservedSpots() {
        return capacity - availableSpots;
    }

    public BigDecimal priceOrZero() {
        return price != null ? price : BigDecimal.ZERO;
    }

    public enum TripStatus {
        DRAFT,
        OPEN,
        CLOSED,
        FULL,
        IN_PROGRESS,
        COMPLETED,
        CANCELLED
    }

    public enum TripType {
        UMRAH,
        HAJJ,
        ZIYARAT,
        EDUCATIONAL,
        OTHER
    }
}
