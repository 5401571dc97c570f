package com.auscomply.api.apra;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.core.domain.IncidentReport;
import com.auscomply.core.domain.IncidentReport.IncidentStatus;
import com.auscomply.core.domain.IncidentReport.IncidentType;
import com.auscomply.core.domain.IncidentReport.Severity;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for APRA incidents and data residency.
 */
@RestController
@RequestMapping("/api/v1/apra")
public class ApraController {

    private final IncidentService incidentService;

    public ApraController(IncidentService incidentService) {
        this.incidentService = incidentService;
    }

    /**
     * POST /api/v1/apra/incidents
     */
    @PostMapping("/incidents")
    public ResponseEntity<IncidentReport> create(@Valid @RequestBody CreateIncidentRequest body,
                                                 HttpServletRequest request) {
        IncidentService.NewIncident incident = new IncidentService.NewIncident(
                body.incidentType(), body.severity(), body.title(), body.description(),
                body.affectedSystems(), body.dataCompromised(), body.bcpActivated(), body.detectedAt());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(incidentService.createIncident(incident, ActorContext.from(request)));
    }

    @GetMapping("/incidents")
    public ResponseEntity<List<IncidentReport>> list(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ResponseEntity.ok(incidentService.listIncidents(from, to));
    }

    @GetMapping("/incidents/{id}")
    public ResponseEntity<IncidentReport> get(@PathVariable UUID id) {
        return ResponseEntity.ok(incidentService.getIncident(id));
    }

    /**
     * POST /api/v1/apra/incidents/{id}/status
     */
    @PostMapping("/incidents/{id}/status")
    public ResponseEntity<IncidentReport> updateStatus(@PathVariable UUID id,
                                                       @Valid @RequestBody StatusUpdateRequest body,
                                                       HttpServletRequest request) {
        return ResponseEntity.ok(incidentService.updateStatus(
                id, body.status(), body.rootCause(), ActorContext.from(request)));
    }

    /**
     * POST /api/v1/apra/incidents/{id}/submit
     */
    @PostMapping("/incidents/{id}/submit")
    public ResponseEntity<IncidentReport> submit(@PathVariable UUID id, HttpServletRequest request) {
        return ResponseEntity.ok(incidentService.submitToApra(id, ActorContext.from(request)));
    }

    @GetMapping("/data-residency")
    public ResponseEntity<DataResidencyChecker.ResidencyStatus> dataResidency() {
        return ResponseEntity.ok(incidentService.checkDataResidency());
    }

    public record CreateIncidentRequest(
            @NotNull IncidentType incidentType,
            @NotNull Severity severity,
            @NotBlank String title,
            String description,
            List<String> affectedSystems,
            boolean dataCompromised,
            boolean bcpActivated,
            Instant detectedAt
    ) {}

    public record StatusUpdateRequest(@NotNull IncidentStatus status, String rootCause) {}
}
