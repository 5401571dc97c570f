package com.auscomply.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-user monitoring aggregate. The row is locked while a transaction for the
 * user is scored, which serialises concurrent evaluations of the same user.
 */
@Entity
@Table(name = "user_risk_windows", uniqueConstraints = {
    @UniqueConstraint(name = "uk_risk_window_user", columnNames = "user_id")
})
public class UserRiskWindow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "transaction_count", nullable = false)
    private long transactionCount;

    @NotNull
    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "last_activity_at")
    private Instant lastActivityAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected UserRiskWindow() {}

    public static UserRiskWindow open(String userId, Instant now) {
        var window = new UserRiskWindow();
        window.userId = userId;
        window.transactionCount = 0;
        window.totalAmount = BigDecimal.ZERO.setScale(2);
        window.updatedAt = now;
        return window;
    }

    /**
     * Folds a scored transaction into the aggregate. Activity time only moves forward
     * so late-arriving transactions do not make an account look dormant.
     */
    public void recordActivity(BigDecimal amount, Instant transactionDate, Instant now) {
        this.transactionCount++;
        this.totalAmount = this.totalAmount.add(amount);
        if (lastActivityAt == null || transactionDate.isAfter(lastActivityAt)) {
            this.lastActivityAt = transactionDate;
        }
        this.updatedAt = now;
    }

    public UUID getId() { return id; }
    public String getUserId() { return userId; }
    public long getTransactionCount() { return transactionCount; }
    public BigDecimal getTotalAmount() { return totalAmount; }
    public Instant getLastActivityAt() { return lastActivityAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Long getVersion() { return version; }
}
