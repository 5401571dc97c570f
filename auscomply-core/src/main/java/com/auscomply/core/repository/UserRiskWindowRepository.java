package com.auscomply.core.repository;

import com.auscomply.core.domain.UserRiskWindow;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserRiskWindowRepository extends JpaRepository<UserRiskWindow, UUID> {

    /**
     * Loads the user's window row with a write lock held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM UserRiskWindow w WHERE w.userId = :userId")
    Optional<UserRiskWindow> findForUpdate(@Param("userId") String userId);

    Optional<UserRiskWindow> findByUserId(String userId);
}
