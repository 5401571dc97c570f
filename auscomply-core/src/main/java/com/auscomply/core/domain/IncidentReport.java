package com.auscomply.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Operational or security incident tracked for APRA CPS 234 notification.
 */
@Entity
@Table(name = "incident_reports", indexes = {
    @Index(name = "idx_incident_detected", columnList = "detected_at"),
    @Index(name = "idx_incident_status", columnList = "status")
})
public class IncidentReport {

    public static final Duration APRA_NOTIFICATION_WINDOW = Duration.ofHours(72);

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "incident_type", nullable = false, updatable = false)
    private IncidentType incidentType;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Severity severity;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IncidentStatus status;

    @NotNull
    @Column(nullable = false, updatable = false)
    private String title;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String description;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "affected_systems", columnDefinition = "TEXT", updatable = false)
    private List<String> affectedSystems = new ArrayList<>();

    @Column(name = "data_compromised", nullable = false, updatable = false)
    private boolean dataCompromised;

    @Column(name = "bcp_activated", nullable = false)
    private boolean bcpActivated;

    @NotNull
    @Column(name = "detected_at", nullable = false, updatable = false)
    private Instant detectedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "root_cause", columnDefinition = "TEXT")
    private String rootCause;

    @Column(name = "reported_to_apra", nullable = false)
    private boolean reportedToApra;

    @Column(name = "apra_reference")
    private String apraReference;

    @Column(name = "reported_at")
    private Instant reportedAt;

    @Column(name = "reported_to_oaic", nullable = false)
    private boolean reportedToOaic;

    @Column(name = "oaic_reference")
    private String oaicReference;

    @Version
    private Long version;

    protected IncidentReport() {}

    public static IncidentReport open(
            IncidentType incidentType,
            Severity severity,
            String title,
            String description,
            List<String> affectedSystems,
            boolean dataCompromised,
            boolean bcpActivated,
            Instant detectedAt) {

        var incident = new IncidentReport();
        incident.incidentType = incidentType;
        incident.severity = severity;
        incident.title = title;
        incident.description = description;
        incident.affectedSystems = affectedSystems == null ? new ArrayList<>() : new ArrayList<>(affectedSystems);
        incident.dataCompromised = dataCompromised;
        incident.bcpActivated = bcpActivated;
        incident.detectedAt = detectedAt;
        incident.status = IncidentStatus.OPEN;
        return incident;
    }

    /**
     * Moves the incident forward. Status never goes backwards.
     */
    public void advanceTo(IncidentStatus next, String rootCause, Instant now) {
        if (next.ordinal() <= status.ordinal()) {
            throw new IllegalStateException("Cannot move incident from " + status + " to " + next);
        }
        this.status = next;
        if (rootCause != null) {
            this.rootCause = rootCause;
        }
        if (next.ordinal() >= IncidentStatus.RESOLVED.ordinal() && resolvedAt == null) {
            this.resolvedAt = now;
        }
    }

    public void markReported(String apraReference, String oaicReference, Instant now) {
        if (reportedToApra) {
            throw new IllegalStateException("Incident already reported to APRA as " + this.apraReference);
        }
        this.reportedToApra = true;
        this.apraReference = apraReference;
        this.reportedAt = now;
        if (oaicReference != null) {
            this.reportedToOaic = true;
            this.oaicReference = oaicReference;
        }
    }

    public boolean requiresRegulatorNotification() {
        return severity == Severity.CRITICAL || severity == Severity.HIGH || dataCompromised;
    }

    public boolean isReportedWithinWindow() {
        return reportedAt != null && !reportedAt.isAfter(detectedAt.plus(APRA_NOTIFICATION_WINDOW));
    }

    // Getters
    public UUID getId() { return id; }
    public IncidentType getIncidentType() { return incidentType; }
    public Severity getSeverity() { return severity; }
    public IncidentStatus getStatus() { return status; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public List<String> getAffectedSystems() { return List.copyOf(affectedSystems); }
    public boolean isDataCompromised() { return dataCompromised; }
    public boolean isBcpActivated() { return bcpActivated; }
    public Instant getDetectedAt() { return detectedAt; }
    public Instant getResolvedAt() { return resolvedAt; }
    public String getRootCause() { return rootCause; }
    public boolean isReportedToApra() { return reportedToApra; }
    public String getApraReference() { return apraReference; }
    public Instant getReportedAt() { return reportedAt; }
    public boolean isReportedToOaic() { return reportedToOaic; }
    public String getOaicReference() { return oaicReference; }

    public enum IncidentType {
        DATA_BREACH,
        SYSTEM_OUTAGE,
        SECURITY_INCIDENT,
        COMPLIANCE_BREACH,
        OPERATIONAL_FAILURE,
        THIRD_PARTY_FAILURE
    }

    public enum Severity {
        CRITICAL, HIGH, MEDIUM, LOW
    }

    // Declaration order is the lifecycle order
    public enum IncidentStatus {
        OPEN, INVESTIGATING, CONTAINED, RESOLVED, CLOSED
    }
}
