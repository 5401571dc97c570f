package com.auscomply.api.gst;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.audit.AuditQuery;
import com.auscomply.api.audit.AuditTrailService;
import com.auscomply.api.error.ComplianceValidationException;
import com.auscomply.api.error.StateConflictException;
import com.auscomply.api.gst.GstClassificationService.BasSummary;
import com.auscomply.api.gst.GstClassificationService.GstClassificationRequest;
import com.auscomply.api.support.MutableClock;
import com.auscomply.api.support.TestClockConfiguration;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import com.auscomply.core.domain.GstTransactionDetail;
import com.auscomply.core.domain.GstTransactionDetail.Direction;
import com.auscomply.core.domain.GstTransactionDetail.GstTreatment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
class GstClassificationServiceTest {

    private static final Instant AUGUST = Instant.parse("2024-08-14T03:00:00Z");
    private static final ActorContext ACTOR = new ActorContext("bookkeeper", "192.0.2.10", "junit");

    @Autowired
    private GstClassificationService gstService;

    @Autowired
    private AuditTrailService auditTrailService;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock.setInstant(Instant.parse("2024-08-20T00:00:00Z"));
    }

    @Test
    void taxableSaleOfOneHundredAndTenDollarsCarriesTenDollarsGst() {
        GstTransactionDetail detail = gstService.classify(
                sale(newTransactionId(), "110.00", null, null, "RETAIL"), ACTOR);

        assertThat(detail.getTreatment()).isEqualTo(GstTreatment.TAXABLE_SUPPLY);
        assertThat(detail.getGstAmount()).isEqualByComparingTo("10.00");
        assertThat(detail.getBaseAmount()).isEqualByComparingTo("100.00");
        assertThat(detail.getGstRate()).isEqualByComparingTo("0.10");
        assertThat(detail.getBasReportingCode()).isEqualTo("G1");
        assertThat(detail.getTaxPeriod()).isEqualTo("2024-08");
        assertThat(detail.isValidated()).isTrue();
    }

    @Test
    void gstReportedOnGstFreeSupplyIsStoredWithError() {
        GstTransactionDetail detail = gstService.classify(
                sale(newTransactionId(), "110.00", "10.00", GstTreatment.GST_FREE, "HEALTH"), ACTOR);

        assertThat(detail.isValidated()).isFalse();
        assertThat(detail.getValidationErrors()).singleElement().asString().contains("GST-free");
        assertThat(detail.getBasReportingCode()).isEqualTo("G3");
    }

    @Test
    void invalidSupplierAbnIsRecordedAsError() {
        GstClassificationRequest request = new GstClassificationRequest(newTransactionId(), new BigDecimal("55.00"),
                null, null, Direction.PURCHASE, "OFFICE", "Stationers", "51 824 753 557", false, AUGUST);

        GstTransactionDetail detail = gstService.classify(request, ACTOR);

        assertThat(detail.getSupplierAbn()).isNull();
        assertThat(detail.getValidationErrors()).anyMatch(e -> e.contains("not a valid ABN"));
        assertThat(detail.isInputTaxCredit()).isTrue();
    }

    @Test
    void classifyingTheSameTransactionTwiceConflicts() {
        String transactionId = newTransactionId();
        gstService.classify(sale(transactionId, "22.00", null, null, "RETAIL"), ACTOR);

        assertThatThrownBy(() -> gstService.classify(sale(transactionId, "22.00", null, null, "RETAIL"), ACTOR))
                .isInstanceOf(StateConflictException.class);
    }

    @Test
    void invalidAmountsAreRejected() {
        assertThatThrownBy(() -> gstService.classify(sale(newTransactionId(), "0", null, null, "RETAIL"), ACTOR))
                .isInstanceOf(ComplianceValidationException.class);
        assertThatThrownBy(() -> gstService.classify(sale(newTransactionId(), "10.00", "11.00", null, "RETAIL"), ACTOR))
                .isInstanceOf(ComplianceValidationException.class);
    }

    @Test
    void flaggingForBasTwiceIsANoOp() {
        GstTransactionDetail detail = gstService.classify(sale(newTransactionId(), "330.00", null, null, "RETAIL"), ACTOR);

        GstTransactionDetail first = gstService.markReportedInBas(detail.getId(), ACTOR);
        clock.setInstant(Instant.parse("2024-08-21T00:00:00Z"));
        GstTransactionDetail second = gstService.markReportedInBas(detail.getId(), ACTOR);

        assertThat(first.isReportedInBas()).isTrue();
        assertThat(second.getReportedInBasAt()).isEqualTo(first.getReportedInBasAt());
        long audits = auditTrailService.query(new AuditQuery(null, null, null, Set.of(OperationType.GST_BAS_REPORTED),
                "GstTransactionDetail", detail.getId().toString(), null), 0, 10).getTotalElements();
        assertThat(audits).isEqualTo(1);
    }

    @Test
    void basSummaryTotalsTheLabels() {
        Instant november = Instant.parse("2019-11-12T01:00:00Z");
        gstService.classify(new GstClassificationRequest(newTransactionId(), new BigDecimal("110.00"), null, null,
                Direction.SALE, "RETAIL", null, null, false, november), ACTOR);
        gstService.classify(new GstClassificationRequest(newTransactionId(), new BigDecimal("500.00"), null, null,
                Direction.SALE, "EXPORT", null, null, false, november), ACTOR);
        gstService.classify(new GstClassificationRequest(newTransactionId(), new BigDecimal("2200.00"), null, null,
                Direction.PURCHASE, "EQUIPMENT", null, "51 824 753 556", true, november), ACTOR);
        gstService.classify(new GstClassificationRequest(newTransactionId(), new BigDecimal("330.00"), null, null,
                Direction.PURCHASE, "STATIONERY", null, null, false, november), ACTOR);

        BasSummary summary = gstService.generateBasSummary("2019-11");

        assertThat(summary.transactionCount()).isEqualTo(4);
        assertThat(summary.totalSales()).isEqualByComparingTo("610.00");
        assertThat(summary.exportSales()).isEqualByComparingTo("500.00");
        assertThat(summary.capitalPurchases()).isEqualByComparingTo("2200.00");
        assertThat(summary.nonCapitalPurchases()).isEqualByComparingTo("330.00");
        assertThat(summary.gstOnSales()).isEqualByComparingTo("10.00");
        assertThat(summary.gstCredits()).isEqualByComparingTo("230.00");
        assertThat(summary.netGst()).isEqualByComparingTo("-220.00");
        assertThat(summary.pendingBasCount()).isEqualTo(4);
        assertThat(summary.withValidationErrors()).isZero();
    }

    @Test
    void malformedTaxPeriodIsRejected() {
        assertThatThrownBy(() -> gstService.generateBasSummary("2024-13"))
                .isInstanceOf(ComplianceValidationException.class);
    }

    @Test
    void abnCheckExplainsFailures() {
        assertThat(gstService.validateAbn("51 824 753 556").valid()).isTrue();
        assertThat(gstService.validateAbn("51824753557").message()).isEqualTo("ABN checksum validation failed");
        assertThat(gstService.validateAbn("1234").message()).isEqualTo("ABN must have 11 digits");
    }

    private static GstClassificationRequest sale(String transactionId, String total, String gst,
                                                 GstTreatment treatment, String category) {
        return new GstClassificationRequest(transactionId, new BigDecimal(total),
                gst == null ? null : new BigDecimal(gst), treatment, Direction.SALE, category, "Store", null, false, AUGUST);
    }

    private static String newTransactionId() {
        return "gst-" + UUID.randomUUID();
    }
}
