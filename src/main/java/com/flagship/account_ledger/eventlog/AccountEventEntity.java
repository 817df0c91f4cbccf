package com.flagship.account_ledger.eventlog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the account_events table.
 *
 * Rows are never updated except for relay bookkeeping (published_at, retry_count,
 * last_error). The unique (account_id, seq_no) constraint is what makes appends
 * optimistic.
 */
@Entity
@Table(
    name = "account_events",
    uniqueConstraints = @UniqueConstraint(name = "uq_account_events_account_seq",
        columnNames = {"account_id", "seq_no"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AccountEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "seq_id", nullable = false, updatable = false)
    private Long seqId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "seq_no", nullable = false, updatable = false)
    private long seqNo;

    @Column(name = "event_type", nullable = false, updatable = false, length = 100)
    private String eventType;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    static AccountEventEntity fromDomain(StoredEvent event) {
        AccountEventEntity entity = new AccountEventEntity();
        entity.accountId = event.getAccountId();
        entity.seqNo = event.getSeqNo();
        entity.eventType = event.getEventType();
        entity.payload = event.getPayload();
        entity.createdAt = event.getCreatedAt();
        entity.publishedAt = event.getPublishedAt();
        entity.retryCount = event.getRetryCount();
        entity.lastError = event.getLastError();
        return entity;
    }

    public StoredEvent toDomain() {
        return new StoredEvent(
            seqId,
            accountId,
            seqNo,
            eventType,
            payload,
            createdAt,
            publishedAt,
            retryCount,
            lastError
        );
    }

    void markPublished() {
        this.publishedAt = Instant.now();
        this.lastError = null;
    }

    void markFailed(String errorMessage) {
        this.retryCount++;
        this.lastError = errorMessage;
    }
}
