package com.auscomply.api.report;

import com.auscomply.api.audit.ActorContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Set;

/**
 * REST API for on-demand compliance reports.
 */
@RestController
@RequestMapping("/api/v1/compliance/reports")
public class ComplianceReportController {

    private final ComplianceReportService reportService;

    public ComplianceReportController(ComplianceReportService reportService) {
        this.reportService = reportService;
    }

    /**
     * POST /api/v1/compliance/reports
     */
    @PostMapping
    public ResponseEntity<ComplianceReport> generate(@Valid @RequestBody GenerateReportRequest body,
                                                     HttpServletRequest request) {
        ComplianceReport report = reportService.generate(
                new ReportPeriod(body.periodStart(), body.periodEnd()),
                body.sections(),
                body.generatedBy(),
                ActorContext.from(request));
        return ResponseEntity.ok(report);
    }

    public record GenerateReportRequest(
            @NotNull Instant periodStart,
            @NotNull Instant periodEnd,
            @NotEmpty Set<ReportSection> sections,
            @NotBlank String generatedBy
    ) {}
}
