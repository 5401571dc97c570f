package com.auscomply.api.audit;

import com.auscomply.api.error.AuditPersistenceException;
import com.auscomply.api.error.ComplianceValidationException;
import com.auscomply.api.error.RecordNotFoundException;
import com.auscomply.core.domain.AuditLogEntry;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import com.auscomply.core.repository.AuditLogEntryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Append-only audit trail with SHA-256 hash chaining.
 *
 * Each write commits in its own transaction, and callers record after their own change
 * has committed. The chain lock is taken only once that transaction holds a connection
 * and is released after it commits, so a thread never waits for a pooled connection
 * while holding the lock. Failed writes are retried with backoff; on exhaustion the
 * failure is counted, logged at ERROR and raised as {@link AuditPersistenceException}.
 */
@Service
public class AuditTrailService {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailService.class);

    public static final int MAX_PAGE_SIZE = 500;
    public static final int MAX_EXPORT_ROWS = 50_000;

    private final AuditLogEntryRepository auditRepository;
    private final RetryTemplate auditRetryTemplate;
    private final TransactionTemplate newTransaction;
    private final ObjectMapper canonicalMapper;
    private final Clock clock;
    private final Counter writeFailures;

    // Serialises chain appends within this JVM; the unique sequence number catches other nodes.
    // Held from inside the write transaction until after its commit.
    private final ReentrantLock chainLock = new ReentrantLock();

    public AuditTrailService(
            AuditLogEntryRepository auditRepository,
            @Qualifier("auditRetryTemplate") RetryTemplate auditRetryTemplate,
            PlatformTransactionManager transactionManager,
            ObjectMapper objectMapper,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.auditRepository = auditRepository;
        this.auditRetryTemplate = auditRetryTemplate;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
        this.writeFailures = Counter.builder("auscomply.audit.write.failures")
                .description("Audit log writes that failed after all retries")
                .register(meterRegistry);
    }

    /**
     * Appends an entry to the audit trail.
     *
     * @throws AuditPersistenceException if the entry could not be written after retries
     */
    public AuditLogEntry record(AuditEvent event) {
        validate(event);
        String previousJson = toJson(event.previousData());
        String currentJson = toJson(event.currentData());
        List<String> changedFields = changedFields(event.previousData(), event.currentData());

        try {
            return auditRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying audit write for {} (attempt {})",
                            event.operationType(), context.getRetryCount() + 1);
                }
                return append(event, previousJson, currentJson, changedFields);
            });
        } catch (DataAccessException | TransactionException e) {
            writeFailures.increment();
            log.error("AUDIT WRITE FAILED after retries: operation={}, resource={}:{}, actor={}",
                    event.operationType(), event.resourceType(), event.resourceId(),
                    event.actor().actorUserId(), e);
            throw new AuditPersistenceException(
                    "Audit entry for " + event.operationType() + " could not be persisted", e);
        }
    }

    /**
     * Convenience for services recording a single operation without snapshots.
     */
    public AuditLogEntry record(ActorContext actor, OperationType operation, String resourceType, Object resourceId) {
        return record(AuditEvent.of(actor, operation, resourceType, resourceId));
    }

    private AuditLogEntry append(AuditEvent event, String previousJson, String currentJson,
                                 List<String> changedFields) {
        try {
            return newTransaction.execute(status -> {
                chainLock.lock();
                Optional<AuditLogEntry> head = auditRepository.findTopByOrderBySequenceNumberDesc();
                long sequence = head.map(h -> h.getSequenceNumber() + 1).orElse(1L);
                String previousHash = head.map(AuditLogEntry::getEntryHash).orElse(AuditLogEntry.GENESIS_HASH);
                Instant now = clock.instant();

                AuditLogEntry entry = AuditLogEntry.create(
                        sequence,
                        event.actor().actorUserId(),
                        event.operationType(),
                        event.resourceType(),
                        event.resourceId(),
                        event.actor().ipAddress(),
                        event.actor().userAgent(),
                        previousJson,
                        currentJson,
                        changedFields,
                        scaled(event.amount()),
                        scaled(event.gstAmount()),
                        AustralianTaxYear.of(now),
                        event.success(),
                        event.errorMessage(),
                        now,
                        previousHash
                );
                entry.seal(sha256(entry.hashMaterial()));
                return auditRepository.saveAndFlush(entry);
            });
        } finally {
            if (chainLock.isHeldByCurrentThread()) {
                chainLock.unlock();
            }
        }
    }

    @Transactional(readOnly = true)
    public AuditLogEntry getEntry(UUID id) {
        return auditRepository.findById(id)
                .orElseThrow(() -> RecordNotFoundException.of("Audit entry", id));
    }

    /**
     * Filtered, paginated read, newest first.
     */
    @Transactional(readOnly = true)
    public Page<AuditLogEntry> query(AuditQuery filters, int page, int size) {
        validateQuery(filters);
        if (page < 0) {
            throw new ComplianceValidationException("Page index must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ComplianceValidationException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }
        return auditRepository.findAll(filters.toSpecification(),
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "sequenceNumber")));
    }

    /**
     * CSV rendering of every entry matching the filters, newest first.
     */
    @Transactional(readOnly = true)
    public String exportCsv(AuditQuery filters) {
        validateQuery(filters);
        List<AuditLogEntry> entries = auditRepository.findAll(filters.toSpecification(),
                PageRequest.of(0, MAX_EXPORT_ROWS, Sort.by(Sort.Direction.DESC, "sequenceNumber")))
                .getContent();
        return AuditCsvWriter.write(entries);
    }

    @Transactional(readOnly = true)
    public AuditSummary summarize(AuditQuery filters) {
        validateQuery(filters);
        List<AuditLogEntry> entries = auditRepository.findAll(filters.toSpecification());

        long successful = entries.stream().filter(AuditLogEntry::isSuccess).count();
        Map<String, Long> byOperation = entries.stream().collect(Collectors.groupingBy(
                e -> e.getOperationType().name(), TreeMap::new, Collectors.counting()));
        Map<String, Long> byResource = entries.stream().collect(Collectors.groupingBy(
                AuditLogEntry::getResourceType, TreeMap::new, Collectors.counting()));
        long uniqueActors = entries.stream().map(AuditLogEntry::getActorUserId).distinct().count();
        BigDecimal totalAmount = entries.stream().map(AuditLogEntry::getAmount)
                .filter(Objects::nonNull).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalGst = entries.stream().map(AuditLogEntry::getGstAmount)
                .filter(Objects::nonNull).reduce(BigDecimal.ZERO, BigDecimal::add);

        return new AuditSummary(entries.size(), successful, entries.size() - successful,
                byOperation, byResource, uniqueActors, totalAmount, totalGst);
    }

    /**
     * Recomputes entry hashes and chain links for entries in the time range.
     */
    @Transactional(readOnly = true)
    public IntegrityReport verifyIntegrity(Instant from, Instant to) {
        AuditQuery range = new AuditQuery(from, to, null, null, null, null, null);
        validateQuery(range);
        List<AuditLogEntry> entries = auditRepository.findAll(range.toSpecification(),
                Sort.by(Sort.Direction.ASC, "sequenceNumber"));

        List<String> problems = new ArrayList<>();
        UUID firstBroken = null;
        AuditLogEntry previous = null;
        for (AuditLogEntry entry : entries) {
            boolean broken = false;
            if (!sha256(entry.hashMaterial()).equals(entry.getEntryHash())) {
                problems.add("Entry " + entry.getSequenceNumber() + " hash does not match its content");
                broken = true;
            }
            String expectedPrevious = expectedPreviousHash(entry, previous);
            if (expectedPrevious == null) {
                problems.add("Entry " + entry.getSequenceNumber() + " has no predecessor in the chain");
                broken = true;
            } else if (!expectedPrevious.equals(entry.getPreviousHash())) {
                problems.add("Entry " + entry.getSequenceNumber() + " is not linked to its predecessor");
                broken = true;
            }
            if (broken && firstBroken == null) {
                firstBroken = entry.getId();
            }
            previous = entry;
        }
        if (!problems.isEmpty()) {
            log.error("Audit chain verification found {} problem(s) between {} and {}", problems.size(), from, to);
        }
        return new IntegrityReport(entries.size(), problems.isEmpty(), problems, firstBroken);
    }

    private String expectedPreviousHash(AuditLogEntry entry, AuditLogEntry previousInRange) {
        if (entry.getSequenceNumber() == 1) {
            return AuditLogEntry.GENESIS_HASH;
        }
        if (previousInRange != null && previousInRange.getSequenceNumber() == entry.getSequenceNumber() - 1) {
            return previousInRange.getEntryHash();
        }
        return auditRepository.findBySequenceNumber(entry.getSequenceNumber() - 1)
                .map(AuditLogEntry::getEntryHash)
                .orElse(null);
    }

    /**
     * Fields whose values differ between the two snapshots. Only computed when both exist.
     */
    static List<String> changedFields(Map<String, Object> previous, Map<String, Object> current) {
        if (previous == null || current == null) {
            return List.of();
        }
        Set<String> keys = new TreeSet<>(previous.keySet());
        keys.addAll(current.keySet());
        return keys.stream()
                .filter(key -> !Objects.equals(String.valueOf(previous.get(key)), String.valueOf(current.get(key))))
                .toList();
    }

    private void validate(AuditEvent event) {
        if (event == null || event.actor() == null) {
            throw new ComplianceValidationException("Audit event requires an actor");
        }
        if (event.operationType() == null) {
            throw new ComplianceValidationException("Audit event requires an operation type");
        }
        if (event.resourceType() == null || event.resourceType().isBlank()) {
            throw new ComplianceValidationException("Audit event requires a resource type");
        }
    }

    private void validateQuery(AuditQuery filters) {
        if (filters.from() != null && filters.to() != null && filters.from().isAfter(filters.to())) {
            throw new ComplianceValidationException("Audit query 'from' must not be after 'to'");
        }
    }

    private String toJson(Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        try {
            return canonicalMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new ComplianceValidationException("Audit data is not serialisable: " + e.getOriginalMessage(), e);
        }
    }

    private static BigDecimal scaled(BigDecimal amount) {
        return amount == null ? null : amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public record AuditSummary(
            long totalEntries,
            long successful,
            long failed,
            Map<String, Long> byOperation,
            Map<String, Long> byResourceType,
            long uniqueActors,
            BigDecimal totalAmount,
            BigDecimal totalGstAmount
    ) {}

    public record IntegrityReport(
            int entriesChecked,
            boolean valid,
            List<String> problems,
            UUID firstBrokenEntryId
    ) {}
}
