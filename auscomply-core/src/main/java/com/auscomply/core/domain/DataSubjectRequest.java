package com.auscomply.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Privacy-law request from a data subject (access, deletion, portability, correction).
 * The response due date is fixed at creation: request date plus the statutory period.
 * Overdue status is derived on read and never stored.
 */
@Entity
@Table(name = "data_subject_requests", indexes = {
    @Index(name = "idx_dsr_user", columnList = "user_id"),
    @Index(name = "idx_dsr_status_due", columnList = "status, due_date"),
    @Index(name = "idx_dsr_request_date", columnList = "request_date")
})
public class DataSubjectRequest {

    public static final Duration RESPONSE_PERIOD = Duration.ofDays(30);
    public static final Duration EXPORT_RETENTION = Duration.ofDays(7);

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "request_type", nullable = false, updatable = false)
    private RequestType requestType;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RequestStatus status;

    @Embedded
    private RequestDetails details;

    @NotNull
    @Column(name = "verification_method", nullable = false, updatable = false)
    private String verificationMethod;

    @NotNull
    @Column(name = "request_date", nullable = false, updatable = false)
    private Instant requestDate;

    @NotNull
    @Column(name = "due_date", nullable = false, updatable = false)
    private Instant dueDate;

    @Column(name = "processed_by")
    private String processedBy;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "export_url", columnDefinition = "TEXT")
    private String exportUrl;

    @Column(name = "export_expires_at")
    private Instant exportExpiresAt;

    @Column(name = "resolution_notes", columnDefinition = "TEXT")
    private String resolutionNotes;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Version
    private Long version;

    protected DataSubjectRequest() {}

    public static DataSubjectRequest create(
            String userId,
            RequestType requestType,
            RequestDetails details,
            String verificationMethod,
            Instant requestDate) {

        var request = new DataSubjectRequest();
        request.userId = userId;
        request.requestType = requestType;
        request.details = details != null ? details : RequestDetails.defaultFor(requestType);
        request.verificationMethod = verificationMethod;
        request.status = RequestStatus.PENDING;
        request.requestDate = requestDate;
        request.dueDate = requestDate.plus(RESPONSE_PERIOD);
        return request;
    }

    /**
     * True when the statutory due date has passed and the request is still open.
     */
    public boolean isOverdueAt(Instant now) {
        return dueDate.isBefore(now) && !status.isTerminal();
    }

    // Getters
    public UUID getId() { return id; }
    public String getUserId() { return userId; }
    public RequestType getRequestType() { return requestType; }
    public RequestStatus getStatus() { return status; }
    public RequestDetails getDetails() { return details; }
    public String getVerificationMethod() { return verificationMethod; }
    public Instant getRequestDate() { return requestDate; }
    public Instant getDueDate() { return dueDate; }
    public String getProcessedBy() { return processedBy; }
    public Instant getProcessedAt() { return processedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public String getExportUrl() { return exportUrl; }
    public Instant getExportExpiresAt() { return exportExpiresAt; }
    public String getResolutionNotes() { return resolutionNotes; }
    public String getRejectionReason() { return rejectionReason; }

    public enum RequestType {
        ACCESS,
        DELETION,
        PORTABILITY,
        CORRECTION
    }

    /**
     * Request states, monotonic PENDING to PROCESSING to COMPLETED or REJECTED.
     * A PENDING request may also be rejected directly.
     */
    public enum RequestStatus {
        PENDING,
        PROCESSING,
        COMPLETED,
        REJECTED;

        public boolean isTerminal() {
            return this == COMPLETED || this == REJECTED;
        }

        public Set<RequestStatus> allowedTransitions() {
            return switch (this) {
                case PENDING -> EnumSet.of(PROCESSING, REJECTED);
                case PROCESSING -> EnumSet.of(COMPLETED, REJECTED);
                case COMPLETED, REJECTED -> EnumSet.noneOf(RequestStatus.class);
            };
        }

        public boolean canTransitionTo(RequestStatus next) {
            return allowedTransitions().contains(next);
        }
    }
}
