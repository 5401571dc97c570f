package com.auscomply.api.audit;

import com.auscomply.core.domain.AuditLogEntry;

import java.util.List;

/**
 * Renders audit entries as RFC 4180 CSV with the columns
 * timestamp, actor, operation, resource, success. Cells that a spreadsheet would
 * read as a formula are prefixed with a single quote.
 */
final class AuditCsvWriter {

    static final String HEADER = "timestamp,actor,operation,resource,success";

    private static final String FORMULA_PREFIXES = "=+-@\t\r";

    private AuditCsvWriter() {}

    static String write(List<AuditLogEntry> entries) {
        StringBuilder csv = new StringBuilder(HEADER).append("\r\n");
        for (AuditLogEntry entry : entries) {
            String resource = entry.getResourceId() == null
                    ? entry.getResourceType()
                    : entry.getResourceType() + ":" + entry.getResourceId();
            csv.append(escape(entry.getTimestamp().toString())).append(',')
               .append(escape(entry.getActorUserId())).append(',')
               .append(escape(entry.getOperationType().name())).append(',')
               .append(escape(resource)).append(',')
               .append(entry.isSuccess())
               .append("\r\n");
        }
        return csv.toString();
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (!value.isEmpty() && FORMULA_PREFIXES.indexOf(value.charAt(0)) >= 0) {
            value = "'" + value;
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
