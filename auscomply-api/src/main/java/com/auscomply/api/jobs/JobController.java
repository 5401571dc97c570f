package com.auscomply.api.jobs;

import com.auscomply.api.aml.RegulatorSubmissionService.SubmissionRun;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.YearMonth;

/**
 * Trigger endpoints for an external scheduler.
 */
@RestController
@RequestMapping("/api/v1/compliance/jobs")
public class JobController {

    private final ComplianceJobs jobs;

    public JobController(ComplianceJobs jobs) {
        this.jobs = jobs;
    }

    /**
     * POST /api/v1/compliance/jobs/consent-expiry
     */
    @PostMapping("/consent-expiry")
    public ResponseEntity<ExpiryResult> expireConsents() {
        return ResponseEntity.ok(new ExpiryResult(jobs.expireConsents()));
    }

    /**
     * POST /api/v1/compliance/jobs/monthly-report?month=2025-01
     */
    @PostMapping("/monthly-report")
    public ResponseEntity<ComplianceJobs.MonthlyReportRun> monthlyReport(@RequestParam YearMonth month) {
        return ResponseEntity.ok(jobs.runMonthlyReport(month));
    }

    /**
     * POST /api/v1/compliance/jobs/regulator-submissions
     */
    @PostMapping("/regulator-submissions")
    public ResponseEntity<SubmissionRun> submitRegulatorReports() {
        return ResponseEntity.ok(jobs.submitRegulatorReports());
    }

    public record ExpiryResult(int expired) {}
}
