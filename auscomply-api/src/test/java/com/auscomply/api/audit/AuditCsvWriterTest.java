package com.auscomply.api.audit;

import com.auscomply.core.domain.AuditLogEntry;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AuditCsvWriterTest {

    private static final Instant TIMESTAMP = Instant.parse("2025-02-03T04:05:06.789Z");

    @Test
    void writesHeaderAndOneRowPerEntry() {
        String csv = AuditCsvWriter.write(List.of(
                entry(1, "analyst-1", OperationType.ALERT_REVIEWED, "RiskRecord", "abc", true),
                entry(2, "system:jobs", OperationType.CONSENTS_EXPIRED, "ConsentRecord", null, false)));

        assertThat(csv.split("\r\n")).containsExactly(
                "timestamp,actor,operation,resource,success",
                "2025-02-03T04:05:06.789Z,analyst-1,ALERT_REVIEWED,RiskRecord:abc,true",
                "2025-02-03T04:05:06.789Z,system:jobs,CONSENTS_EXPIRED,ConsentRecord,false");
    }

    @Test
    void quotesFieldsContainingSeparatorsAndQuotes() {
        assertThat(AuditCsvWriter.escape("plain")).isEqualTo("plain");
        assertThat(AuditCsvWriter.escape("a,b")).isEqualTo("\"a,b\"");
        assertThat(AuditCsvWriter.escape("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
        assertThat(AuditCsvWriter.escape("two\nlines")).isEqualTo("\"two\nlines\"");
        assertThat(AuditCsvWriter.escape(null)).isEmpty();
    }

    @Test
    void neutralisesCellsThatStartLikeFormulas() {
        assertThat(AuditCsvWriter.escape("=HYPERLINK(\"http://x\")")).isEqualTo("\"'=HYPERLINK(\"\"http://x\"\")\"");
        assertThat(AuditCsvWriter.escape("+61400000000")).isEqualTo("'+61400000000");
        assertThat(AuditCsvWriter.escape("-2+3")).isEqualTo("'-2+3");
        assertThat(AuditCsvWriter.escape("@SUM(A1)")).isEqualTo("'@SUM(A1)");
        assertThat(AuditCsvWriter.escape("user=admin")).isEqualTo("user=admin");

        String csv = AuditCsvWriter.write(List.of(
                entry(3, "=cmd|' /C calc'!A0", OperationType.CONSENT_GRANTED, "ConsentRecord", "c-1", true)));
        assertThat(csv.split("\r\n")[1]).isEqualTo(
                "2025-02-03T04:05:06.789Z,'=cmd|' /C calc'!A0,CONSENT_GRANTED,ConsentRecord:c-1,true");
    }

    @Test
    void emptyExportIsHeaderOnly() {
        assertThat(AuditCsvWriter.write(List.of())).isEqualTo(AuditCsvWriter.HEADER + "\r\n");
    }

    private static AuditLogEntry entry(long sequence, String actor, OperationType operation,
                                       String resourceType, String resourceId, boolean success) {
        return AuditLogEntry.create(sequence, actor, operation, resourceType, resourceId, "10.0.0.1", "test",
                null, null, List.of(), null, null, "2024/2025", success, success ? null : "failed",
                TIMESTAMP, AuditLogEntry.GENESIS_HASH);
    }
}
