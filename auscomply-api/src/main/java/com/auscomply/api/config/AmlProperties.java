package com.auscomply.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * AML/CTF monitoring thresholds. Amounts are in AUD.
 */
@Configuration
@ConfigurationProperties(prefix = "auscomply.aml")
public class AmlProperties {

    private BigDecimal cashThreshold = new BigDecimal("10000");
    private BigDecimal internationalThreshold = new BigDecimal("1000");
    private BigDecimal structuringMargin = new BigDecimal("1000");
    private int structuringWindowDays = 7;
    private int dailyTransactionLimit = 20;
    private BigDecimal dailyAmountLimit = new BigDecimal("50000");
    private int burstTransactionLimit = 3;
    private int burstWindowMinutes = 5;
    private int dormantAfterDays = 180;
    private BigDecimal reviewThreshold = new BigDecimal("0.5");
    private BigDecimal highRiskThreshold = new BigDecimal("0.75");
    private BigDecimal reportingThreshold = new BigDecimal("0.85");
    private List<String> highRiskCategories = new ArrayList<>(
            List.of("GAMBLING", "CRYPTOCURRENCY", "MONEY_TRANSFER", "CASH_ADVANCE"));
    private List<String> watchlistedCounterparties = new ArrayList<>();
    private int maxSubmissionAttempts = 5;
    private int submissionBatchSize = 50;

    public BigDecimal getCashThreshold() { return cashThreshold; }
    public void setCashThreshold(BigDecimal cashThreshold) { this.cashThreshold = cashThreshold; }
    public BigDecimal getInternationalThreshold() { return internationalThreshold; }
    public void setInternationalThreshold(BigDecimal internationalThreshold) { this.internationalThreshold = internationalThreshold; }
    public BigDecimal getStructuringMargin() { return structuringMargin; }
    public void setStructuringMargin(BigDecimal structuringMargin) { this.structuringMargin = structuringMargin; }
    public int getStructuringWindowDays() { return structuringWindowDays; }
    public void setStructuringWindowDays(int structuringWindowDays) { this.structuringWindowDays = structuringWindowDays; }
    public int getDailyTransactionLimit() { return dailyTransactionLimit; }
    public void setDailyTransactionLimit(int dailyTransactionLimit) { this.dailyTransactionLimit = dailyTransactionLimit; }
    public BigDecimal getDailyAmountLimit() { return dailyAmountLimit; }
    public void setDailyAmountLimit(BigDecimal dailyAmountLimit) { this.dailyAmountLimit = dailyAmountLimit; }
    public int getBurstTransactionLimit() { return burstTransactionLimit; }
    public void setBurstTransactionLimit(int burstTransactionLimit) { this.burstTransactionLimit = burstTransactionLimit; }
    public int getBurstWindowMinutes() { return burstWindowMinutes; }
    public void setBurstWindowMinutes(int burstWindowMinutes) { this.burstWindowMinutes = burstWindowMinutes; }
    public int getDormantAfterDays() { return dormantAfterDays; }
    public void setDormantAfterDays(int dormantAfterDays) { this.dormantAfterDays = dormantAfterDays; }
    public BigDecimal getReviewThreshold() { return reviewThreshold; }
    public void setReviewThreshold(BigDecimal reviewThreshold) { this.reviewThreshold = reviewThreshold; }
    public BigDecimal getHighRiskThreshold() { return highRiskThreshold; }
    public void setHighRiskThreshold(BigDecimal highRiskThreshold) { this.highRiskThreshold = highRiskThreshold; }
    public BigDecimal getReportingThreshold() { return reportingThreshold; }
    public void setReportingThreshold(BigDecimal reportingThreshold) { this.reportingThreshold = reportingThreshold; }
    public List<String> getHighRiskCategories() { return highRiskCategories; }
    public void setHighRiskCategories(List<String> highRiskCategories) { this.highRiskCategories = highRiskCategories; }
    public List<String> getWatchlistedCounterparties() { return watchlistedCounterparties; }
    public void setWatchlistedCounterparties(List<String> watchlistedCounterparties) { this.watchlistedCounterparties = watchlistedCounterparties; }
    public int getMaxSubmissionAttempts() { return maxSubmissionAttempts; }
    public void setMaxSubmissionAttempts(int maxSubmissionAttempts) { this.maxSubmissionAttempts = maxSubmissionAttempts; }
    public int getSubmissionBatchSize() { return submissionBatchSize; }
    public void setSubmissionBatchSize(int submissionBatchSize) { this.submissionBatchSize = submissionBatchSize; }
}
