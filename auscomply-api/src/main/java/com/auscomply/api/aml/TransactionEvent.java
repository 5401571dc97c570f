package com.auscomply.api.aml;

import com.auscomply.core.domain.RiskRecord;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * A posted financial transaction submitted for AML/CTF scoring.
 */
public record TransactionEvent(
        @NotBlank String transactionId,
        @NotBlank String userId,
        @NotNull @Positive BigDecimal amount,
        String currency,
        @NotNull Instant transactionDate,
        String category,
        String merchantName,
        String description,
        boolean international,
        String counterparty
) {

    public String currencyOrDefault() {
        return currency == null || currency.isBlank() ? "AUD" : currency.toUpperCase(Locale.ROOT);
    }

    RiskRecord.TransactionFacts toFacts() {
        return new RiskRecord.TransactionFacts(
                transactionId, userId, amount, currencyOrDefault(), transactionDate,
                category, merchantName, international);
    }
}
