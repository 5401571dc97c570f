package com.auscomply.api.audit;

import com.auscomply.core.domain.AuditLogEntry;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * REST API for the audit trail: filtered reads, CSV export and chain verification.
 */
@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final AuditTrailService auditTrailService;

    public AuditController(AuditTrailService auditTrailService) {
        this.auditTrailService = auditTrailService;
    }

    /**
     * GET /api/v1/audit/entries
     */
    @GetMapping("/entries")
    public ResponseEntity<AuditPage> queryEntries(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) String actorUserId,
            @RequestParam(required = false) Set<OperationType> operationType,
            @RequestParam(required = false) String resourceType,
            @RequestParam(required = false) String resourceId,
            @RequestParam(required = false) Boolean success,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {

        AuditQuery filters = new AuditQuery(from, to, actorUserId, operationType, resourceType, resourceId, success);
        Page<AuditLogEntry> result = auditTrailService.query(filters, page, size);
        return ResponseEntity.ok(new AuditPage(result.getContent(), result.getNumber(), result.getSize(),
                result.getTotalElements(), result.getTotalPages()));
    }

    /**
     * GET /api/v1/audit/entries/{id}
     */
    @GetMapping("/entries/{id}")
    public ResponseEntity<AuditLogEntry> getEntry(@PathVariable UUID id) {
        return ResponseEntity.ok(auditTrailService.getEntry(id));
    }

    /**
     * GET /api/v1/audit/export.csv
     */
    @GetMapping(value = "/export.csv", produces = "text/csv")
    public ResponseEntity<String> exportCsv(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) String actorUserId,
            @RequestParam(required = false) Set<OperationType> operationType,
            @RequestParam(required = false) String resourceType,
            @RequestParam(required = false) Boolean success) {

        AuditQuery filters = new AuditQuery(from, to, actorUserId, operationType, resourceType, null, success);
        String csv = auditTrailService.exportCsv(filters);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"audit-log.csv\"")
                .contentType(new MediaType("text", "csv"))
                .body(csv);
    }

    /**
     * GET /api/v1/audit/summary
     */
    @GetMapping("/summary")
    public ResponseEntity<AuditTrailService.AuditSummary> summary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) String actorUserId) {
        AuditQuery filters = new AuditQuery(from, to, actorUserId, null, null, null, null);
        return ResponseEntity.ok(auditTrailService.summarize(filters));
    }

    /**
     * GET /api/v1/audit/integrity
     */
    @GetMapping("/integrity")
    public ResponseEntity<AuditTrailService.IntegrityReport> verifyIntegrity(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ResponseEntity.ok(auditTrailService.verifyIntegrity(from, to));
    }

    public record AuditPage(
            List<AuditLogEntry> entries,
            int page,
            int size,
            long totalElements,
            int totalPages
    ) {}
}
