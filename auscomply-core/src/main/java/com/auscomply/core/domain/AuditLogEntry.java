package com.auscomply.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Immutable audit log entry for every compliance-relevant event.
 * Entries form a hash chain: each stores the hash of its predecessor.
 * Every column is insert-only and the lifecycle callbacks refuse updates and deletes.
 */
@Entity
@Table(name = "audit_log_entries", indexes = {
    @Index(name = "idx_audit_log_timestamp", columnList = "event_timestamp"),
    @Index(name = "idx_audit_log_actor", columnList = "actor_user_id"),
    @Index(name = "idx_audit_log_operation", columnList = "operation_type"),
    @Index(name = "idx_audit_log_resource", columnList = "resource_type, resource_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_audit_log_sequence", columnNames = "sequence_number")
})
public class AuditLogEntry {

    public static final String GENESIS_HASH = "GENESIS";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private long sequenceNumber;

    @NotNull
    @Column(name = "actor_user_id", nullable = false, updatable = false)
    private String actorUserId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "operation_type", nullable = false, updatable = false, length = 64)
    private OperationType operationType;

    @NotNull
    @Column(name = "resource_type", nullable = false, updatable = false)
    private String resourceType;

    @Column(name = "resource_id", updatable = false)
    private String resourceId;

    @Column(name = "ip_address", updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "TEXT", updatable = false)
    private String userAgent;

    @Column(name = "previous_data", columnDefinition = "TEXT", updatable = false)
    private String previousData;

    @Column(name = "current_data", columnDefinition = "TEXT", updatable = false)
    private String currentData;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "changed_fields", columnDefinition = "TEXT", updatable = false)
    private List<String> changedFields = new ArrayList<>();

    @Column(precision = 19, scale = 2, updatable = false)
    private BigDecimal amount;

    @Column(name = "gst_amount", precision = 19, scale = 2, updatable = false)
    private BigDecimal gstAmount;

    @NotNull
    @Column(name = "tax_year", nullable = false, length = 9, updatable = false)
    private String taxYear;

    @Column(nullable = false, updatable = false)
    private boolean success;

    @Column(name = "error_message", columnDefinition = "TEXT", updatable = false)
    private String errorMessage;

    @NotNull
    @Column(name = "event_timestamp", nullable = false, updatable = false)
    private Instant timestamp;

    @NotNull
    @Column(name = "previous_hash", nullable = false, updatable = false, length = 64)
    private String previousHash;

    @NotNull
    @Column(name = "entry_hash", nullable = false, updatable = false, length = 64)
    private String entryHash;

    protected AuditLogEntry() {}

    /**
     * Creates an entry linked to its predecessor. The caller computes the entry hash
     * from {@link #hashMaterial()} once all fields are set.
     */
    public static AuditLogEntry create(
            long sequenceNumber,
            String actorUserId,
            OperationType operationType,
            String resourceType,
            String resourceId,
            String ipAddress,
            String userAgent,
            String previousData,
            String currentData,
            List<String> changedFields,
            BigDecimal amount,
            BigDecimal gstAmount,
            String taxYear,
            boolean success,
            String errorMessage,
            Instant timestamp,
            String previousHash) {

        var entry = new AuditLogEntry();
        entry.sequenceNumber = sequenceNumber;
        entry.actorUserId = actorUserId;
        entry.operationType = operationType;
        entry.resourceType = resourceType;
        entry.resourceId = resourceId;
        entry.ipAddress = ipAddress;
        entry.userAgent = userAgent;
        entry.previousData = previousData;
        entry.currentData = currentData;
        entry.changedFields = new ArrayList<>(changedFields);
        entry.amount = amount;
        entry.gstAmount = gstAmount;
        entry.taxYear = taxYear;
        entry.success = success;
        entry.errorMessage = errorMessage;
        entry.timestamp = timestamp;
        entry.previousHash = previousHash;
        return entry;
    }

    /**
     * Canonical text covered by the entry hash.
     */
    public String hashMaterial() {
        return String.join("|",
                Long.toString(sequenceNumber),
                actorUserId,
                operationType.name(),
                resourceType,
                nullToEmpty(resourceId),
                nullToEmpty(ipAddress),
                nullToEmpty(previousData),
                nullToEmpty(currentData),
                String.join(",", changedFields),
                amount == null ? "" : amount.toPlainString(),
                gstAmount == null ? "" : gstAmount.toPlainString(),
                Boolean.toString(success),
                nullToEmpty(errorMessage),
                timestamp.toString(),
                previousHash
        );
    }

    public void seal(String entryHash) {
        if (this.entryHash != null) {
            throw new IllegalStateException("Audit entry already sealed");
        }
        this.entryHash = entryHash;
    }

    @PreUpdate
    void rejectUpdate() {
        throw new IllegalStateException("Audit log entries are immutable");
    }

    @PreRemove
    void rejectRemove() {
        throw new IllegalStateException("Audit log entries cannot be deleted");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    // Getters
    public UUID getId() { return id; }
    public long getSequenceNumber() { return sequenceNumber; }
    public String getActorUserId() { return actorUserId; }
    public OperationType getOperationType() { return operationType; }
    public String getResourceType() { return resourceType; }
    public String getResourceId() { return resourceId; }
    public String getIpAddress() { return ipAddress; }
    public String getUserAgent() { return userAgent; }
    public String getPreviousData() { return previousData; }
    public String getCurrentData() { return currentData; }
    public List<String> getChangedFields() { return List.copyOf(changedFields); }
    public BigDecimal getAmount() { return amount; }
    public BigDecimal getGstAmount() { return gstAmount; }
    public String getTaxYear() { return taxYear; }
    public boolean isSuccess() { return success; }
    public String getErrorMessage() { return errorMessage; }
    public Instant getTimestamp() { return timestamp; }
    public String getPreviousHash() { return previousHash; }
    public String getEntryHash() { return entryHash; }

    public enum OperationType {
        // AML
        RISK_EVALUATED,
        RISK_EVALUATION_FAILED,
        ALERT_REVIEWED,
        REGULATOR_REPORT_SUBMITTED,
        REGULATOR_REPORT_FAILED,
        // Privacy
        CONSENT_GRANTED,
        CONSENT_WITHDRAWN,
        CONSENTS_EXPIRED,
        DSR_CREATED,
        DSR_PROCESSING,
        DSR_COMPLETED,
        DSR_REJECTED,
        // GST
        GST_CLASSIFIED,
        GST_BAS_REPORTED,
        // APRA
        INCIDENT_CREATED,
        INCIDENT_STATUS_CHANGED,
        INCIDENT_REPORTED,
        // Reporting
        REPORT_GENERATED,
        REPORT_ARCHIVED,
        AUDIT_EXPORTED
    }
}
