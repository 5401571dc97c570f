package com.auscomply.api.gst;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.gst.GstClassificationService.AbnCheck;
import com.auscomply.api.gst.GstClassificationService.BasSummary;
import com.auscomply.api.gst.GstClassificationService.GstCalculation;
import com.auscomply.api.gst.GstClassificationService.GstClassificationRequest;
import com.auscomply.core.domain.GstTransactionDetail;
import com.auscomply.core.domain.GstTransactionDetail.Direction;
import com.auscomply.core.domain.GstTransactionDetail.GstTreatment;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * REST API for GST classification and BAS preparation.
 */
@RestController
@RequestMapping("/api/v1/gst")
public class GstController {

    private final GstClassificationService gstService;

    public GstController(GstClassificationService gstService) {
        this.gstService = gstService;
    }

    /**
     * POST /api/v1/gst/transactions
     */
    @PostMapping("/transactions")
    public ResponseEntity<GstTransactionDetail> classify(@Valid @RequestBody ClassifyRequest body,
                                                         HttpServletRequest request) {
        GstClassificationRequest classification = new GstClassificationRequest(
                body.transactionId(), body.totalAmount(), body.gstAmount(), body.treatment(), body.direction(),
                body.category(), body.merchantName(), body.supplierAbn(), body.capitalPurchase(),
                body.transactionDate());
        GstTransactionDetail detail = gstService.classify(classification, ActorContext.from(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(detail);
    }

    @GetMapping("/transactions/{id}")
    public ResponseEntity<GstTransactionDetail> get(@PathVariable UUID id) {
        return ResponseEntity.ok(gstService.getDetail(id));
    }

    @GetMapping("/transactions/by-transaction/{transactionId}")
    public ResponseEntity<GstTransactionDetail> getByTransactionId(@PathVariable String transactionId) {
        return ResponseEntity.ok(gstService.getByTransactionId(transactionId));
    }

    /**
     * POST /api/v1/gst/transactions/{id}/bas-reported
     */
    @PostMapping("/transactions/{id}/bas-reported")
    public ResponseEntity<GstTransactionDetail> markReportedInBas(@PathVariable UUID id, HttpServletRequest request) {
        return ResponseEntity.ok(gstService.markReportedInBas(id, ActorContext.from(request)));
    }

    /**
     * GET /api/v1/gst/calculate?amount=110.00&category=OFFICE_SUPPLIES
     */
    @GetMapping("/calculate")
    public ResponseEntity<GstCalculation> calculate(@RequestParam BigDecimal amount,
                                                    @RequestParam(required = false) String category) {
        return ResponseEntity.ok(gstService.calculateGst(amount, category));
    }

    @GetMapping("/abn/{abn}")
    public ResponseEntity<AbnCheck> validateAbn(@PathVariable String abn) {
        return ResponseEntity.ok(gstService.validateAbn(abn));
    }

    /**
     * GET /api/v1/gst/bas/{taxPeriod}
     */
    @GetMapping("/bas/{taxPeriod}")
    public ResponseEntity<BasSummary> basSummary(@PathVariable String taxPeriod) {
        return ResponseEntity.ok(gstService.generateBasSummary(taxPeriod));
    }

    public record ClassifyRequest(
            @NotBlank String transactionId,
            @NotNull @DecimalMin(value = "0.01") BigDecimal totalAmount,
            BigDecimal gstAmount,
            GstTreatment treatment,
            Direction direction,
            String category,
            String merchantName,
            String supplierAbn,
            boolean capitalPurchase,
            @NotNull Instant transactionDate
    ) {}
}
