package com.auscomply.api.gst;

import com.auscomply.core.domain.GstTransactionDetail.Direction;
import com.auscomply.core.domain.GstTransactionDetail.GstTreatment;
import net.jqwik.api.*;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Property tests for GST treatment, amounts and BAS label rules.
 */
class GstRulesPropertyTest {

    @Property
    void expectedGstOnTaxableTotalPassesValidation(@ForAll("totals") BigDecimal total) {
        BigDecimal gst = GstRules.expectedGst(total, GstTreatment.TAXABLE_SUPPLY);

        assertThat(GstRules.validate(GstTreatment.TAXABLE_SUPPLY, total.subtract(gst), gst)).isEmpty();
    }

    @Property
    void nonTaxableSuppliesCarryNoGst(@ForAll("totals") BigDecimal total, @ForAll("nonTaxable") GstTreatment treatment) {
        assertThat(GstRules.expectedGst(total, treatment)).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(GstRules.rateFor(treatment)).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(GstRules.validate(treatment, total, BigDecimal.ZERO)).isEmpty();
    }

    @Property
    void gstOnNonTaxableSupplyIsAnError(@ForAll("totals") BigDecimal gst, @ForAll("nonTaxable") GstTreatment treatment) {
        assertThat(GstRules.validate(treatment, new BigDecimal("100.00"), gst)).hasSize(1);
    }

    @Example
    void oneHundredAndTenDollarsContainsTenDollarsGst() {
        assertThat(GstRules.expectedGst(new BigDecimal("110.00"), GstTreatment.TAXABLE_SUPPLY))
                .isEqualByComparingTo("10.00");
        assertThat(GstRules.rateFor(GstTreatment.TAXABLE_SUPPLY)).isEqualByComparingTo("0.10");
    }

    @Example
    void gstOutsideToleranceIsReported() {
        assertThat(GstRules.validate(GstTreatment.TAXABLE_SUPPLY, new BigDecimal("100.00"), new BigDecimal("10.01")))
                .isEmpty();
        assertThat(GstRules.validate(GstTreatment.TAXABLE_SUPPLY, new BigDecimal("100.00"), new BigDecimal("10.02")))
                .singleElement().asString().contains("expected 10.00");
    }

    @Example
    void treatmentFollowsCategoryThenMerchant() {
        assertThat(GstRules.treatmentFor("basic food", null)).isEqualTo(GstTreatment.GST_FREE);
        assertThat(GstRules.treatmentFor("financial_supplies", null)).isEqualTo(GstTreatment.INPUT_TAXED);
        assertThat(GstRules.treatmentFor("WAGES", null)).isEqualTo(GstTreatment.OUT_OF_SCOPE);
        assertThat(GstRules.treatmentFor("SHOPPING", "Corner Pharmacy")).isEqualTo(GstTreatment.GST_FREE);
        assertThat(GstRules.treatmentFor("SHOPPING", "Hardware Store")).isEqualTo(GstTreatment.TAXABLE_SUPPLY);
        assertThat(GstRules.treatmentFor(null, null)).isEqualTo(GstTreatment.TAXABLE_SUPPLY);
    }

    @Example
    void basLabels() {
        assertThat(GstRules.basCode(GstTreatment.TAXABLE_SUPPLY, Direction.SALE, "RETAIL", false)).isEqualTo("G1");
        assertThat(GstRules.basCode(GstTreatment.GST_FREE, Direction.SALE, "EXPORT", false)).isEqualTo("G2");
        assertThat(GstRules.basCode(GstTreatment.GST_FREE, Direction.SALE, "HEALTH", false)).isEqualTo("G3");
        assertThat(GstRules.basCode(GstTreatment.INPUT_TAXED, Direction.SALE, "RESIDENTIAL_RENT", false)).isEqualTo("G4");
        assertThat(GstRules.basCode(GstTreatment.TAXABLE_SUPPLY, Direction.PURCHASE, "EQUIPMENT", true)).isEqualTo("G10");
        assertThat(GstRules.basCode(GstTreatment.TAXABLE_SUPPLY, Direction.PURCHASE, "STATIONERY", false)).isEqualTo("G11");
        assertThat(GstRules.basCode(GstTreatment.OUT_OF_SCOPE, Direction.SALE, "WAGES", false))
                .isEqualTo(GstRules.OUT_OF_SCOPE_CODE);
    }

    @Example
    void taxPeriodUsesSydneyLocalDate() {
        assertThat(GstRules.taxPeriod(Instant.parse("2025-01-31T12:59:59Z"))).isEqualTo("2025-01");
        assertThat(GstRules.taxPeriod(Instant.parse("2025-01-31T13:00:00Z"))).isEqualTo("2025-02");
    }

    @Provide
    Arbitrary<BigDecimal> totals() {
        return Arbitraries.bigDecimals()
                .between(new BigDecimal("0.01"), new BigDecimal("1000000"))
                .ofScale(2);
    }

    @Provide
    Arbitrary<GstTreatment> nonTaxable() {
        return Arbitraries.of(GstTreatment.GST_FREE, GstTreatment.INPUT_TAXED, GstTreatment.OUT_OF_SCOPE);
    }
}
