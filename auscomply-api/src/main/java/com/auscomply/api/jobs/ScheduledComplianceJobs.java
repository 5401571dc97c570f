package com.auscomply.api.jobs;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneId;

/**
 * Cron wiring for {@link ComplianceJobs}, enabled with {@code auscomply.jobs.scheduling-enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "auscomply.jobs", name = "scheduling-enabled", havingValue = "true")
public class ScheduledComplianceJobs {

    private static final ZoneId SYDNEY = ZoneId.of("Australia/Sydney");

    private final ComplianceJobs jobs;
    private final Clock clock;

    public ScheduledComplianceJobs(ComplianceJobs jobs, Clock clock) {
        this.jobs = jobs;
        this.clock = clock;
    }

    @Scheduled(cron = "${auscomply.jobs.consent-expiry-cron:0 0 2 * * *}", zone = "Australia/Sydney")
    public void expireConsents() {
        jobs.expireConsents();
    }

    @Scheduled(cron = "${auscomply.jobs.monthly-report-cron:0 0 3 1 * *}", zone = "Australia/Sydney")
    public void monthlyReport() {
        jobs.runMonthlyReport(YearMonth.now(clock.withZone(SYDNEY)).minusMonths(1));
    }

    @Scheduled(fixedDelayString = "${auscomply.jobs.submission-interval-ms:900000}")
    public void submitRegulatorReports() {
        jobs.submitRegulatorReports();
    }
}
