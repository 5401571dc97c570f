package com.auscomply.api.report;

import com.auscomply.api.error.ComplianceValidationException;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;

/**
 * Reporting window [start, end). Monthly periods follow Sydney calendar months.
 */
public record ReportPeriod(Instant start, Instant end) {

    public static final ZoneId REPORTING_ZONE = ZoneId.of("Australia/Sydney");

    public ReportPeriod {
        if (start == null || end == null) {
            throw new ComplianceValidationException("Report period start and end are required");
        }
        if (start.isAfter(end)) {
            throw new ComplianceValidationException("Report period start " + start + " is after end " + end);
        }
    }

    public static ReportPeriod ofMonth(YearMonth month) {
        return new ReportPeriod(
                month.atDay(1).atStartOfDay(REPORTING_ZONE).toInstant(),
                month.plusMonths(1).atDay(1).atStartOfDay(REPORTING_ZONE).toInstant());
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
