package com.auscomply.api.audit;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Australian financial year label ("2024/2025"), running 1 July to 30 June in Sydney time.
 */
public final class AustralianTaxYear {

    public static final ZoneId SYDNEY = ZoneId.of("Australia/Sydney");

    private AustralianTaxYear() {}

    public static String of(Instant instant) {
        LocalDate date = instant.atZone(SYDNEY).toLocalDate();
        int startYear = date.getMonthValue() >= 7 ? date.getYear() : date.getYear() - 1;
        return startYear + "/" + (startYear + 1);
    }
}
