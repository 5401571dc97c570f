package com.auscomply.core.repository;

import com.auscomply.core.domain.AuditLogEntry;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for audit log entries.
 * Deliberately extends the bare {@link Repository}: only insert and read operations exist.
 */
@org.springframework.stereotype.Repository
public interface AuditLogEntryRepository extends Repository<AuditLogEntry, UUID>,
        JpaSpecificationExecutor<AuditLogEntry> {

    <S extends AuditLogEntry> S saveAndFlush(S entry);

    Optional<AuditLogEntry> findById(UUID id);

    /**
     * Chain head, used to link the next entry.
     */
    Optional<AuditLogEntry> findTopByOrderBySequenceNumberDesc();

    Optional<AuditLogEntry> findBySequenceNumber(long sequenceNumber);

    List<AuditLogEntry> findBySequenceNumberBetweenOrderBySequenceNumberAsc(long from, long to);

    long count();
}
