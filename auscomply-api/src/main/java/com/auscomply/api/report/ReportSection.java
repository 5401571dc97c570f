package com.auscomply.api.report;

public enum ReportSection {
    AML,
    PRIVACY,
    APRA,
    GST
}
