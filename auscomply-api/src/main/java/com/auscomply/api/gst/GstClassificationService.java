package com.auscomply.api.gst;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.audit.AuditEvent;
import com.auscomply.api.audit.AuditTrailService;
import com.auscomply.api.error.ComplianceValidationException;
import com.auscomply.api.error.RecordNotFoundException;
import com.auscomply.api.error.StateConflictException;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import com.auscomply.core.domain.GstTransactionDetail;
import com.auscomply.core.domain.GstTransactionDetail.Direction;
import com.auscomply.core.domain.GstTransactionDetail.GstTreatment;
import com.auscomply.core.repository.GstTransactionDetailRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * GST classification and BAS preparation for Australian transactions.
 *
 * All amounts are GST-inclusive totals. A classification is stored once per
 * transaction; afterwards only the BAS reporting flag changes.
 */
@Service
public class GstClassificationService {

    private static final Logger log = LoggerFactory.getLogger(GstClassificationService.class);

    static final String RESOURCE_TYPE = "GstTransactionDetail";

    private final GstTransactionDetailRepository gstRepository;
    private final AuditTrailService auditTrailService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public GstClassificationService(
            GstTransactionDetailRepository gstRepository,
            AuditTrailService auditTrailService,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.gstRepository = gstRepository;
        this.auditTrailService = auditTrailService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Classifies and stores a transaction. Validation problems with the reported GST
     * are stored on the detail as errors rather than rejected.
     *
     * @throws StateConflictException if the transaction was already classified
     */
    public GstTransactionDetail classify(GstClassificationRequest request, ActorContext actor) {
        validate(request);
        if (gstRepository.existsByTransactionId(request.transactionId())) {
            throw new StateConflictException("Transaction " + request.transactionId() + " is already classified");
        }

        BigDecimal total = request.totalAmount().setScale(2, RoundingMode.HALF_UP);
        GstTreatment treatment = request.treatment() != null
                ? request.treatment()
                : GstRules.treatmentFor(request.category(), request.merchantName());
        Direction direction = request.direction() != null ? request.direction() : Direction.SALE;

        BigDecimal expectedGst = GstRules.expectedGst(total, treatment);
        BigDecimal actualGst = request.reportedGstAmount() != null
                ? request.reportedGstAmount().setScale(2, RoundingMode.HALF_UP)
                : expectedGst;
        BigDecimal base = total.subtract(actualGst);

        List<String> errors = new ArrayList<>(GstRules.validate(treatment, base, actualGst));
        String supplierAbn = null;
        if (request.supplierAbn() != null && !request.supplierAbn().isBlank()) {
            supplierAbn = AbnValidator.normalize(request.supplierAbn());
            if (!AbnValidator.isValid(supplierAbn)) {
                errors.add("Supplier ABN " + request.supplierAbn() + " is not a valid ABN");
                supplierAbn = null;
            }
        }

        GstTransactionDetail detail = GstTransactionDetail.classified(
                request.transactionId(),
                total,
                base,
                actualGst,
                expectedGst,
                GstRules.rateFor(treatment),
                treatment,
                direction,
                GstRules.normalizeCategory(request.category()),
                request.merchantName(),
                supplierAbn,
                GstRules.basCode(treatment, direction, request.category(), request.capitalPurchase()),
                GstRules.taxPeriod(request.transactionDate()),
                errors,
                request.transactionDate(),
                clock.instant());

        GstTransactionDetail saved;
        try {
            saved = transactionTemplate.execute(status -> gstRepository.saveAndFlush(detail));
        } catch (DataIntegrityViolationException e) {
            throw new StateConflictException("Transaction " + request.transactionId() + " is already classified");
        }

        if (!saved.isValidated()) {
            log.warn("GST validation failed for transaction {}: {}", saved.getTransactionId(), saved.getValidationErrors());
        }
        auditTrailService.record(AuditEvent.of(actor, OperationType.GST_CLASSIFIED, RESOURCE_TYPE, saved.getId())
                .withData(null, snapshot(saved))
                .withAmounts(saved.getTotalAmount(), saved.getGstAmount()));
        return saved;
    }

    /**
     * Flags a detail as included in a BAS lodgement. Flagging twice is a no-op.
     */
    public GstTransactionDetail markReportedInBas(UUID id, ActorContext actor) {
        BasFlag flag = transactionTemplate.execute(status -> {
            GstTransactionDetail current = gstRepository.findById(id)
                    .orElseThrow(() -> RecordNotFoundException.of("GST transaction detail", id));
            if (current.isReportedInBas()) {
                return new BasFlag(null, current, false);
            }
            Map<String, Object> before = snapshot(current);
            int updated = gstRepository.markReportedInBas(id, clock.instant());
            GstTransactionDetail flagged = gstRepository.findById(id)
                    .orElseThrow(() -> RecordNotFoundException.of("GST transaction detail", id));
            return new BasFlag(before, flagged, updated > 0);
        });

        GstTransactionDetail flagged = flag.detail();
        if (flag.changed()) {
            auditTrailService.record(AuditEvent.of(actor, OperationType.GST_BAS_REPORTED, RESOURCE_TYPE, id)
                    .withData(flag.before(), snapshot(flagged))
                    .withAmounts(flagged.getTotalAmount(), flagged.getGstAmount()));
        }
        return flagged;
    }

    @Transactional(readOnly = true)
    public GstTransactionDetail getDetail(UUID id) {
        return gstRepository.findById(id)
                .orElseThrow(() -> RecordNotFoundException.of("GST transaction detail", id));
    }

    @Transactional(readOnly = true)
    public GstTransactionDetail getByTransactionId(String transactionId) {
        return gstRepository.findByTransactionId(transactionId)
                .orElseThrow(() -> RecordNotFoundException.of("GST transaction detail", transactionId));
    }

    /**
     * GST breakdown of a GST-inclusive amount without storing anything.
     */
    public GstCalculation calculateGst(BigDecimal totalAmount, String category) {
        if (totalAmount == null || totalAmount.signum() <= 0) {
            throw new ComplianceValidationException("Amount must be positive");
        }
        BigDecimal total = totalAmount.setScale(2, RoundingMode.HALF_UP);
        GstTreatment treatment = GstRules.treatmentFor(category, null);
        BigDecimal gst = GstRules.expectedGst(total, treatment);
        return new GstCalculation(total, total.subtract(gst), gst, GstRules.rateFor(treatment), treatment);
    }

    public AbnCheck validateAbn(String abn) {
        if (abn == null || abn.isBlank()) {
            throw new ComplianceValidationException("ABN is required");
        }
        String digits = AbnValidator.normalize(abn);
        if (digits.length() != 11) {
            return new AbnCheck(abn, false, null, "ABN must have 11 digits");
        }
        if (!AbnValidator.isValid(digits)) {
            return new AbnCheck(abn, false, AbnValidator.format(digits), "ABN checksum validation failed");
        }
        return new AbnCheck(abn, true, AbnValidator.format(digits), null);
    }

    /**
     * BAS worksheet totals for one monthly tax period ({@code yyyy-MM}).
     */
    @Transactional(readOnly = true)
    public BasSummary generateBasSummary(String taxPeriod) {
        try {
            YearMonth.parse(taxPeriod == null ? "" : taxPeriod, GstRules.TAX_PERIOD_FORMAT);
        } catch (DateTimeParseException e) {
            throw new ComplianceValidationException("Tax period must be formatted yyyy-MM: " + taxPeriod, e);
        }

        BigDecimal g1 = zero();
        BigDecimal g2 = zero();
        BigDecimal g3 = zero();
        BigDecimal g4 = zero();
        BigDecimal g10 = zero();
        BigDecimal g11 = zero();
        BigDecimal gstOnSales = zero();
        BigDecimal gstCredits = zero();
        int count = 0;
        int pending = 0;
        int withErrors = 0;

        for (GstTransactionDetail detail : gstRepository.findByTaxPeriodOrderByTransactionDateAsc(taxPeriod)) {
            count++;
            if (!detail.isReportedInBas()) {
                pending++;
            }
            if (!detail.isValidated()) {
                withErrors++;
            }
            BigDecimal total = detail.getTotalAmount();
            switch (detail.getBasReportingCode()) {
                case "G1" -> g1 = g1.add(total);
                case "G2" -> g2 = g2.add(total);
                case "G3" -> g3 = g3.add(total);
                case "G4" -> g4 = g4.add(total);
                case "G10" -> g10 = g10.add(total);
                case "G11" -> g11 = g11.add(total);
                default -> { }
            }
            if (detail.getDirection() == Direction.SALE && detail.getTreatment() == GstTreatment.TAXABLE_SUPPLY) {
                gstOnSales = gstOnSales.add(detail.getGstAmount());
            }
            if (detail.isInputTaxCredit()) {
                gstCredits = gstCredits.add(detail.getGstAmount());
            }
        }

        // G1 is total sales and includes the G2 to G4 amounts
        BigDecimal totalSales = g1.add(g2).add(g3).add(g4);
        return new BasSummary(taxPeriod, count, totalSales, g2, g3, g4, g10, g11,
                gstOnSales, gstCredits, gstOnSales.subtract(gstCredits), pending, withErrors);
    }

    private void validate(GstClassificationRequest request) {
        if (request == null) {
            throw new ComplianceValidationException("Classification request is required");
        }
        if (request.transactionId() == null || request.transactionId().isBlank()) {
            throw new ComplianceValidationException("Transaction ID is required");
        }
        if (request.totalAmount() == null || request.totalAmount().signum() <= 0) {
            throw new ComplianceValidationException("Total amount must be positive");
        }
        if (request.reportedGstAmount() != null && request.reportedGstAmount().signum() < 0) {
            throw new ComplianceValidationException("GST amount cannot be negative");
        }
        if (request.reportedGstAmount() != null && request.reportedGstAmount().compareTo(request.totalAmount()) > 0) {
            throw new ComplianceValidationException("GST amount cannot exceed the total amount");
        }
        if (request.transactionDate() == null) {
            throw new ComplianceValidationException("Transaction date is required");
        }
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(2);
    }

    private static Map<String, Object> snapshot(GstTransactionDetail detail) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("transactionId", detail.getTransactionId());
        data.put("totalAmount", detail.getTotalAmount());
        data.put("baseAmount", detail.getBaseAmount());
        data.put("gstAmount", detail.getGstAmount());
        data.put("treatment", detail.getTreatment().name());
        data.put("direction", detail.getDirection().name());
        data.put("basReportingCode", detail.getBasReportingCode());
        data.put("taxPeriod", detail.getTaxPeriod());
        data.put("validated", detail.isValidated());
        data.put("validationErrors", detail.getValidationErrors());
        data.put("reportedInBas", detail.isReportedInBas());
        return data;
    }

    private record BasFlag(Map<String, Object> before, GstTransactionDetail detail, boolean changed) {}

    public record GstClassificationRequest(
            String transactionId,
            BigDecimal totalAmount,
            BigDecimal reportedGstAmount,
            GstTreatment treatment,
            Direction direction,
            String category,
            String merchantName,
            String supplierAbn,
            boolean capitalPurchase,
            Instant transactionDate
    ) {}

    public record GstCalculation(
            BigDecimal totalAmount,
            BigDecimal baseAmount,
            BigDecimal gstAmount,
            BigDecimal gstRate,
            GstTreatment treatment
    ) {}

    public record AbnCheck(String abn, boolean valid, String formatted, String message) {}

    public record BasSummary(
            String taxPeriod,
            int transactionCount,
            BigDecimal totalSales,
            BigDecimal exportSales,
            BigDecimal otherGstFreeSales,
            BigDecimal inputTaxedSales,
            BigDecimal capitalPurchases,
            BigDecimal nonCapitalPurchases,
            BigDecimal gstOnSales,
            BigDecimal gstCredits,
            BigDecimal netGst,
            int pendingBasCount,
            int withValidationErrors
    ) {}
}
