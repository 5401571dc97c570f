package com.auscomply.api.apra;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.audit.AuditEvent;
import com.auscomply.api.audit.AuditTrailService;
import com.auscomply.api.error.ComplianceValidationException;
import com.auscomply.api.error.RecordNotFoundException;
import com.auscomply.api.error.StateConflictException;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import com.auscomply.core.domain.IncidentReport;
import com.auscomply.core.domain.IncidentReport.IncidentStatus;
import com.auscomply.core.domain.IncidentReport.IncidentType;
import com.auscomply.core.domain.IncidentReport.Severity;
import com.auscomply.core.repository.IncidentReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * APRA CPS 234 incident tracking and notification.
 *
 * Material incidents must reach APRA within 72 hours of detection; incidents that
 * compromised personal data are also notified to the OAIC under the Notifiable Data
 * Breaches scheme. Each change commits before its audit entry is written.
 */
@Service
public class IncidentService {

    private static final Logger log = LoggerFactory.getLogger(IncidentService.class);

    static final String RESOURCE_TYPE = "IncidentReport";

    private static final DateTimeFormatter REFERENCE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final IncidentReportRepository incidentRepository;
    private final DataResidencyChecker residencyChecker;
    private final AuditTrailService auditTrailService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public IncidentService(
            IncidentReportRepository incidentRepository,
            DataResidencyChecker residencyChecker,
            AuditTrailService auditTrailService,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.incidentRepository = incidentRepository;
        this.residencyChecker = residencyChecker;
        this.auditTrailService = auditTrailService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Opens an incident. {@code detectedAt} defaults to now and may not be in the future.
     */
    public IncidentReport createIncident(NewIncident incident, ActorContext actor) {
        if (incident == null || incident.incidentType() == null || incident.severity() == null) {
            throw new ComplianceValidationException("Incident type and severity are required");
        }
        if (incident.title() == null || incident.title().isBlank()) {
            throw new ComplianceValidationException("Incident title is required");
        }
        Instant now = clock.instant();
        Instant detectedAt = incident.detectedAt() != null ? incident.detectedAt() : now;
        if (detectedAt.isAfter(now)) {
            throw new ComplianceValidationException("Detection time cannot be in the future");
        }

        IncidentReport opened = IncidentReport.open(
                incident.incidentType(),
                incident.severity(),
                incident.title(),
                incident.description(),
                incident.affectedSystems(),
                incident.dataCompromised(),
                incident.bcpActivated(),
                detectedAt);
        IncidentReport saved = transactionTemplate.execute(status -> incidentRepository.saveAndFlush(opened));

        if (saved.requiresRegulatorNotification()) {
            log.warn("Incident {} ({}, {}) requires APRA notification by {}", saved.getId(),
                    saved.getIncidentType(), saved.getSeverity(),
                    saved.getDetectedAt().plus(IncidentReport.APRA_NOTIFICATION_WINDOW));
        } else {
            log.info("Incident {} opened: type={}, severity={}", saved.getId(), saved.getIncidentType(), saved.getSeverity());
        }
        auditTrailService.record(AuditEvent.of(actor, OperationType.INCIDENT_CREATED, RESOURCE_TYPE, saved.getId())
                .withData(null, snapshot(saved)));
        return saved;
    }

    /**
     * Moves an incident forward in its lifecycle. Steps may be skipped; going back is a conflict.
     */
    public IncidentReport updateStatus(UUID id, IncidentStatus status, String rootCause, ActorContext actor) {
        if (status == null) {
            throw new ComplianceValidationException("Status is required");
        }
        Change change = transactionTemplate.execute(tx -> {
            IncidentReport incident = getIncident(id);
            Map<String, Object> before = snapshot(incident);
            try {
                incident.advanceTo(status, rootCause, clock.instant());
            } catch (IllegalStateException e) {
                throw new StateConflictException(e.getMessage());
            }
            return new Change(before, incidentRepository.saveAndFlush(incident));
        });
        log.info("Incident {} moved to {}", id, status);
        auditTrailService.record(AuditEvent.of(actor, OperationType.INCIDENT_STATUS_CHANGED, RESOURCE_TYPE, id)
                .withData(change.before(), snapshot(change.incident())));
        return change.incident();
    }

    /**
     * Records notification of the incident to APRA, and to the OAIC when personal
     * data was compromised.
     *
     * @throws StateConflictException if the incident was already reported
     */
    public IncidentReport submitToApra(UUID id, ActorContext actor) {
        Instant now = clock.instant();
        String suffix = REFERENCE_DATE.format(now) + "-" + id.toString().substring(0, 8).toUpperCase(Locale.ROOT);
        String apraReference = "APRA-" + suffix;
        Change change = transactionTemplate.execute(tx -> {
            IncidentReport incident = getIncident(id);
            Map<String, Object> before = snapshot(incident);
            String oaicReference = incident.isDataCompromised() ? "OAIC-NDB-" + suffix : null;
            try {
                incident.markReported(apraReference, oaicReference, now);
            } catch (IllegalStateException e) {
                throw new StateConflictException(e.getMessage());
            }
            return new Change(before, incidentRepository.saveAndFlush(incident));
        });
        IncidentReport saved = change.incident();

        if (!saved.isReportedWithinWindow()) {
            log.warn("Incident {} reported to APRA after the {}h notification window (detected {})",
                    id, IncidentReport.APRA_NOTIFICATION_WINDOW.toHours(), saved.getDetectedAt());
        } else {
            log.info("Incident {} reported to APRA as {}", id, apraReference);
        }
        auditTrailService.record(AuditEvent.of(actor, OperationType.INCIDENT_REPORTED, RESOURCE_TYPE, id)
                .withData(change.before(), snapshot(saved)));
        return saved;
    }

    @Transactional(readOnly = true)
    public IncidentReport getIncident(UUID id) {
        return incidentRepository.findById(id).orElseThrow(() -> RecordNotFoundException.of("Incident", id));
    }

    @Transactional(readOnly = true)
    public List<IncidentReport> listIncidents(Instant from, Instant to) {
        if (from != null && to != null && !from.isBefore(to)) {
            throw new ComplianceValidationException("'from' must be before 'to'");
        }
        return incidentRepository.findDetectedInPeriod(
                from != null ? from : Instant.EPOCH,
                to != null ? to : clock.instant().plusSeconds(1));
    }

    public DataResidencyChecker.ResidencyStatus checkDataResidency() {
        DataResidencyChecker.ResidencyStatus status = residencyChecker.check();
        if (!status.compliant()) {
            log.warn("Data residency violations: {}", status.violations());
        }
        return status;
    }

    private static Map<String, Object> snapshot(IncidentReport incident) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("incidentType", incident.getIncidentType().name());
        data.put("severity", incident.getSeverity().name());
        data.put("status", incident.getStatus().name());
        data.put("title", incident.getTitle());
        data.put("dataCompromised", incident.isDataCompromised());
        data.put("detectedAt", incident.getDetectedAt());
        data.put("resolvedAt", incident.getResolvedAt());
        data.put("rootCause", incident.getRootCause());
        data.put("reportedToApra", incident.isReportedToApra());
        data.put("apraReference", incident.getApraReference());
        data.put("reportedToOaic", incident.isReportedToOaic());
        return data;
    }

    public record NewIncident(
            IncidentType incidentType,
            Severity severity,
            String title,
            String description,
            List<String> affectedSystems,
            boolean dataCompromised,
            boolean bcpActivated,
            Instant detectedAt
    ) {}

    private record Change(Map<String, Object> before, IncidentReport incident) {}
}
