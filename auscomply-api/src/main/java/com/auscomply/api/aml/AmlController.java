package com.auscomply.api.aml;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.core.domain.RiskRecord;
import com.auscomply.core.domain.RiskRecord.ReviewDecision;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for AML/CTF transaction monitoring.
 */
@RestController
@RequestMapping("/api/v1/aml")
public class AmlController {

    private final RiskScoringService riskScoringService;
    private final AmlAlertService alertService;

    public AmlController(RiskScoringService riskScoringService, AmlAlertService alertService) {
        this.riskScoringService = riskScoringService;
        this.alertService = alertService;
    }

    /**
     * Score a transaction.
     * POST /api/v1/aml/transactions
     */
    @PostMapping("/transactions")
    public ResponseEntity<RiskRecord> evaluate(
            @Valid @RequestBody TransactionEvent transaction,
            HttpServletRequest request) {
        RiskRecord record = riskScoringService.evaluate(transaction, ActorContext.from(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }

    /**
     * GET /api/v1/aml/transactions/{transactionId}
     */
    @GetMapping("/transactions/{transactionId}")
    public ResponseEntity<RiskRecord> getByTransaction(@PathVariable String transactionId) {
        return ResponseEntity.ok(alertService.getByTransactionId(transactionId));
    }

    /**
     * GET /api/v1/aml/alerts/pending
     */
    @GetMapping("/alerts/pending")
    public ResponseEntity<List<RiskRecord>> pendingAlerts(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(alertService.getPendingAlerts(limit));
    }

    /**
     * POST /api/v1/aml/alerts/{id}/review
     */
    @PostMapping("/alerts/{id}/review")
    public ResponseEntity<RiskRecord> review(
            @PathVariable UUID id,
            @Valid @RequestBody ReviewRequest body,
            HttpServletRequest request) {
        RiskRecord record = alertService.reviewAlert(
                id, body.reviewer(), body.decision(), body.notes(), ActorContext.from(request));
        return ResponseEntity.ok(record);
    }

    public record ReviewRequest(@NotBlank String reviewer, @NotNull ReviewDecision decision, String notes) {}
}
