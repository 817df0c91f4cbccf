package com.flagship.account_ledger.eventlog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the account event log.
 */
@Repository
public interface AccountEventRepository extends JpaRepository<AccountEventEntity, Long> {

    /**
     * History of one account, used to rebuild its state.
     */
    List<AccountEventEntity> findByAccountIdOrderBySeqNoAsc(UUID accountId);

    /**
     * Next batch for the relay, in global append order.
     * Rows locked by another relay transaction are skipped, and so are all events of an
     * account that has a pending event at or past the retry limit.
     */
    @Query(value = """
        SELECT e.* FROM account_events e
        WHERE e.published_at IS NULL
          AND NOT EXISTS (
            SELECT 1 FROM account_events d
            WHERE d.account_id = e.account_id
              AND d.published_at IS NULL
              AND d.retry_count >= :maxRetries
          )
        ORDER BY e.seq_id ASC
        LIMIT :limit
        FOR UPDATE OF e SKIP LOCKED
        """, nativeQuery = true)
    List<AccountEventEntity> findUnpublishedForUpdate(@Param("limit") int limit, @Param("maxRetries") int maxRetries);

    @Query("SELECT COUNT(e) FROM AccountEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    /**
     * Events that keep failing to relay. Used for alerting.
     */
    long countByPublishedAtIsNullAndRetryCountGreaterThanEqual(int retryCount);

    /**
     * Creation time of the oldest event still waiting for the relay. Used for lag monitoring.
     */
    @Query("""
        SELECT MIN(e.createdAt) FROM AccountEventEntity e
        WHERE e.publishedAt IS NULL
        """)
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
