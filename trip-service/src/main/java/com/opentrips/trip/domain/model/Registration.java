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
 * One member's booking on one trip. Never deleted: cancellation is a terminal status
 * so revenue and audit history survive.
 */
@Entity
@Table(name = "registrations",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_registrations_trip_number",
                columnNames = {"trip_id", "registration_number"}),
        indexes = {
                @Index(name = "idx_registrations_organization", columnList = "organization_id"),
                @Index(name = "idx_registrations_trip", columnList = "trip_id"),
                @Index(name = "idx_registrations_member", columnList = "member_id")
        })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Registration {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "trip_id", nullable = false)
    private Long tripId;

    @Column(name = "member_id", nullable = false)
    private Long memberId;

    @Column(name = "registration_number", nullable = false, length = 40)
    private String registrationNumber;

    @Column(name = "registration_date", nullable = false)
    private LocalDate registrationDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RegistrationStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "amount_paid", nullable = false, precision = 12, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "deposit_paid", nullable = false, precision = 12, scale = 2)
    private BigDecimal depositPaid;

    @Column(name = "balance_due", nullable = false, precision = 12, scale = 2)
    private BigDecimal balanceDue;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "room_type", length = 20)
    private RoomType roomType;

    @Column(name = "passport_number", length = 50)
    private String passportNumber;

    @Column(name = "passport_expiry")
    private LocalDate passportExpiry;

    @Column(name = "passport_country", length = 100)
    private String passportCountry;

    @Enumerated(EnumType.STRING)
    @Column(name = "visa_status", nullable = false, length = 30)
    private VisaStatus visaStatus;

    @Column(name = "visa_number", length = 50)
    private String visaNumber;

    @Column(name = "visa_issue_date")
    private LocalDate visaIssueDate;

    @Column(name = "visa_expiry_date")
    private LocalDate visaExpiryDate;

    @Column(name = "visa_notes")
    private String visaNotes;

    @Column(name = "special_requests")
    private String specialRequests;

    @Column(name = "notes")
    private String notes;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    @Column(name = "refund_amount", precision = 12, scale = 2)
    private BigDecimal refundAmount;

    @Column(name = "refund_date")
    private LocalDate refundDate;

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
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isCancelled() {
        return status == RegistrationStatus.CANCELLED;
    }

    /**
     * Pending and confirmed registrations were counted against trip capacity.
     */
    public boolean holdsSeat() {
        return status == RegistrationStatus.PENDING || status == RegistrationStatus.CONFIRMED;
    }

    public void cancel(String reason, BigDecimal refund, LocalDateTime at) {
        this.status = RegistrationStatus.CANCELLED;
        this.cancelledAt = at;
        this.cancellationReason = reason;
        if (refund != null) {
            this.refundAmount = refund;
            this.refundDate = at.toLocalDate();
        }
    }

    public enum RegistrationStatus {
        PENDING,
        CONFIRMED,
        WAITLISTED,
        CANCELLED
    }

    public enum PaymentStatus {
        PENDING,
        DEPOSIT_PAID,
        PARTIAL,
        PAID
    }

    public enum VisaStatus {
        NOT_STARTED,
        DOCUMENTS_SUBMITTED,
        IN_PROGRESS,
        APPROVED,
        REJECTED,
        ISSUED
    }

    public enum RoomType {
        SINGLE,
        DOUBLE,
        TRIPLE,
        QUAD,
        FAMILY
    }
}
