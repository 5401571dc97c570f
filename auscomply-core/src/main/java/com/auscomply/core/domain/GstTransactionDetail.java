package com.auscomply.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * GST classification of one transaction. Created once; the only later change is the
 * one-way BAS reporting flag.
 */
@Entity
@Table(name = "gst_transaction_details", indexes = {
    @Index(name = "idx_gst_period", columnList = "tax_period"),
    @Index(name = "idx_gst_created", columnList = "created_at"),
    @Index(name = "idx_gst_bas", columnList = "reported_in_bas")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_gst_transaction", columnNames = "transaction_id")
})
public class GstTransactionDetail {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "transaction_id", nullable = false, updatable = false)
    private String transactionId;

    @NotNull
    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal totalAmount;

    @NotNull
    @Column(name = "base_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal baseAmount;

    @NotNull
    @Column(name = "gst_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal gstAmount;

    @NotNull
    @Column(name = "expected_gst_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal expectedGstAmount;

    @NotNull
    @Column(name = "gst_rate", nullable = false, precision = 5, scale = 4, updatable = false)
    private BigDecimal gstRate;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private GstTreatment treatment;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Direction direction;

    @Column(name = "tax_category", updatable = false)
    private String taxCategory;

    @Column(name = "merchant_name", updatable = false)
    private String merchantName;

    @Column(name = "supplier_abn", length = 11, updatable = false)
    private String supplierAbn;

    @Column(name = "input_tax_credit", nullable = false, updatable = false)
    private boolean inputTaxCredit;

    @NotNull
    @Column(name = "bas_reporting_code", nullable = false, length = 4, updatable = false)
    private String basReportingCode;

    @NotNull
    @Column(name = "tax_period", nullable = false, length = 7, updatable = false)
    private String taxPeriod;

    @Column(nullable = false, updatable = false)
    private boolean validated;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "validation_errors", columnDefinition = "TEXT", updatable = false)
    private List<String> validationErrors = new ArrayList<>();

    @Column(name = "reported_in_bas", nullable = false)
    private boolean reportedInBas;

    @Column(name = "reported_in_bas_at")
    private Instant reportedInBasAt;

    @NotNull
    @Column(name = "transaction_date", nullable = false, updatable = false)
    private Instant transactionDate;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    protected GstTransactionDetail() {}

    /**
     * Builds a classified detail. {@code validated} follows directly from an empty
     * error list so the two can never disagree.
     */
    public static GstTransactionDetail classified(
            String transactionId,
            BigDecimal totalAmount,
            BigDecimal baseAmount,
            BigDecimal gstAmount,
            BigDecimal expectedGstAmount,
            BigDecimal gstRate,
            GstTreatment treatment,
            Direction direction,
            String taxCategory,
            String merchantName,
            String supplierAbn,
            String basReportingCode,
            String taxPeriod,
            List<String> validationErrors,
            Instant transactionDate,
            Instant now) {

        var detail = new GstTransactionDetail();
        detail.transactionId = transactionId;
        detail.totalAmount = totalAmount;
        detail.baseAmount = baseAmount;
        detail.gstAmount = gstAmount;
        detail.expectedGstAmount = expectedGstAmount;
        detail.gstRate = gstRate;
        detail.treatment = treatment;
        detail.direction = direction;
        detail.taxCategory = taxCategory;
        detail.merchantName = merchantName;
        detail.supplierAbn = supplierAbn;
        detail.inputTaxCredit = direction == Direction.PURCHASE
                && treatment == GstTreatment.TAXABLE_SUPPLY
                && gstAmount.signum() > 0;
        detail.basReportingCode = basReportingCode;
        detail.taxPeriod = taxPeriod;
        detail.validationErrors = new ArrayList<>(validationErrors);
        detail.validated = validationErrors.isEmpty();
        detail.transactionDate = transactionDate;
        detail.createdAt = now;
        return detail;
    }

    // Getters
    public UUID getId() { return id; }
    public String getTransactionId() { return transactionId; }
    public BigDecimal getTotalAmount() { return totalAmount; }
    public BigDecimal getBaseAmount() { return baseAmount; }
    public BigDecimal getGstAmount() { return gstAmount; }
    public BigDecimal getExpectedGstAmount() { return expectedGstAmount; }
    public BigDecimal getGstRate() { return gstRate; }
    public GstTreatment getTreatment() { return treatment; }
    public Direction getDirection() { return direction; }
    public String getTaxCategory() { return taxCategory; }
    public String getMerchantName() { return merchantName; }
    public String getSupplierAbn() { return supplierAbn; }
    public boolean isInputTaxCredit() { return inputTaxCredit; }
    public String getBasReportingCode() { return basReportingCode; }
    public String getTaxPeriod() { return taxPeriod; }
    public boolean isValidated() { return validated; }
    public List<String> getValidationErrors() { return List.copyOf(validationErrors); }
    public boolean isReportedInBas() { return reportedInBas; }
    public Instant getReportedInBasAt() { return reportedInBasAt; }
    public Instant getTransactionDate() { return transactionDate; }
    public Instant getCreatedAt() { return createdAt; }

    public enum GstTreatment {
        TAXABLE_SUPPLY,
        GST_FREE,
        INPUT_TAXED,
        OUT_OF_SCOPE
    }

    public enum Direction {
        SALE,
        PURCHASE
    }
}
