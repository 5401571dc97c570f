package com.auscomply.api.gst;

import com.auscomply.core.domain.GstTransactionDetail.Direction;
import com.auscomply.core.domain.GstTransactionDetail.GstTreatment;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * GST treatment, amount and BAS rules for GST-inclusive totals at the 10% rate.
 */
final class GstRules {

    static final BigDecimal GST_RATE = new BigDecimal("0.10");
    static final BigDecimal ZERO_RATE = new BigDecimal("0.0000");
    static final BigDecimal TOLERANCE = new BigDecimal("0.01");
    static final ZoneId TAX_ZONE = ZoneId.of("Australia/Sydney");
    static final DateTimeFormatter TAX_PERIOD_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    static final String OUT_OF_SCOPE_CODE = "NA";

    private static final BigDecimal ELEVEN = BigDecimal.valueOf(11);

    private static final Set<String> GST_FREE_CATEGORIES = Set.of(
            "BASIC_FOOD", "HEALTH", "EDUCATION", "CHILDCARE", "MEDICAL", "EXPORTS", "EXPORT", "INTERNATIONAL");
    private static final Set<String> EXPORT_CATEGORIES = Set.of("EXPORTS", "EXPORT", "INTERNATIONAL");
    private static final Set<String> INPUT_TAXED_CATEGORIES = Set.of(
            "FINANCIAL_SUPPLIES", "RESIDENTIAL_RENT", "RESIDENTIAL_PREMISES");
    private static final Set<String> OUT_OF_SCOPE_CATEGORIES = Set.of(
            "WAGES", "DONATION", "GOVERNMENT_FEE", "TRANSFER");
    private static final List<String> GST_FREE_MERCHANT_KEYWORDS = List.of(
            "pharmacy", "chemist", "medical centre", "university", "tafe", "school");

    private GstRules() {}

    static GstTreatment treatmentFor(String category, String merchantName) {
        String normalized = normalizeCategory(category);
        if (OUT_OF_SCOPE_CATEGORIES.contains(normalized)) {
            return GstTreatment.OUT_OF_SCOPE;
        }
        if (INPUT_TAXED_CATEGORIES.contains(normalized)) {
            return GstTreatment.INPUT_TAXED;
        }
        if (GST_FREE_CATEGORIES.contains(normalized)) {
            return GstTreatment.GST_FREE;
        }
        if (merchantName != null) {
            String merchant = merchantName.toLowerCase(Locale.ROOT);
            for (String keyword : GST_FREE_MERCHANT_KEYWORDS) {
                if (merchant.contains(keyword)) {
                    return GstTreatment.GST_FREE;
                }
            }
        }
        return GstTreatment.TAXABLE_SUPPLY;
    }

    /**
     * GST contained in a GST-inclusive total: total / 11, rounded half-up to cents.
     */
    static BigDecimal expectedGst(BigDecimal total, GstTreatment treatment) {
        if (treatment != GstTreatment.TAXABLE_SUPPLY) {
            return BigDecimal.ZERO.setScale(2);
        }
        return total.divide(ELEVEN, 2, RoundingMode.HALF_UP);
    }

    static BigDecimal rateFor(GstTreatment treatment) {
        return treatment == GstTreatment.TAXABLE_SUPPLY ? GST_RATE.setScale(4) : ZERO_RATE;
    }

    static List<String> validate(GstTreatment treatment, BigDecimal baseAmount, BigDecimal gstAmount) {
        List<String> errors = new ArrayList<>();
        if (treatment == GstTreatment.TAXABLE_SUPPLY) {
            BigDecimal tenPercent = baseAmount.multiply(GST_RATE).setScale(2, RoundingMode.HALF_UP);
            if (gstAmount.subtract(tenPercent).abs().compareTo(TOLERANCE) > 0) {
                errors.add("GST amount " + gstAmount + " does not equal 10% of base amount "
                        + baseAmount + " (expected " + tenPercent + ")");
            }
        } else if (gstAmount.signum() != 0) {
            errors.add(describe(treatment) + " supply must not include GST, found " + gstAmount);
        }
        return errors;
    }

    static String basCode(GstTreatment treatment, Direction direction, String category, boolean capitalPurchase) {
        if (treatment == GstTreatment.OUT_OF_SCOPE) {
            return OUT_OF_SCOPE_CODE;
        }
        if (direction == Direction.PURCHASE) {
            return capitalPurchase ? "G10" : "G11";
        }
        if (EXPORT_CATEGORIES.contains(normalizeCategory(category))) {
            return "G2";
        }
        return switch (treatment) {
            case GST_FREE -> "G3";
            case INPUT_TAXED -> "G4";
            default -> "G1";
        };
    }

    static String taxPeriod(Instant transactionDate) {
        return YearMonth.from(transactionDate.atZone(TAX_ZONE)).format(TAX_PERIOD_FORMAT);
    }

    static String normalizeCategory(String category) {
        return category == null ? "" : category.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
    }

    private static String describe(GstTreatment treatment) {
        return switch (treatment) {
            case GST_FREE -> "GST-free";
            case INPUT_TAXED -> "Input-taxed";
            case OUT_OF_SCOPE -> "Out-of-scope";
            case TAXABLE_SUPPLY -> "Taxable";
        };
    }
}
