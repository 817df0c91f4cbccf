package com.flagship.account_ledger.eventlog;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event as stored in the event log, with its relay bookkeeping.
 *
 * Key properties:
 * - {@code seqId} is global and only used to relay in append order
 * - {@code seqNo} orders events within one account
 * - {@code publishedAt} is null until the relay got a broker acknowledgment
 */
@Value
public class StoredEvent {
    Long seqId;
    UUID accountId;
    long seqNo;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;

    /**
     * Creates a new, not yet relayed event.
     */
    public static StoredEvent create(UUID accountId, long seqNo, String eventType, String payload) {
        return new StoredEvent(
            null,  // assigned by database
            accountId,
            seqNo,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
