package com.flagship.account_ledger.eventlog;

import com.flagship.account_ledger.account.event.AccountEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * PostgreSQL-backed event log.
 *
 * Appends commit in their own transaction: once {@link #append} returns, the event is
 * durable and will be relayed to the projection, whatever happens to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventLogService implements EventLog {

    private final AccountEventRepository repository;
    private final AccountEventCodec codec;

    @Override
    @Transactional(readOnly = true)
    public EventHistory load(UUID accountId) {
        List<AccountEventEntity> rows = repository.findByAccountIdOrderBySeqNoAsc(accountId);
        if (rows.isEmpty()) {
            return EventHistory.empty();
        }

        List<AccountEvent> events = rows.stream()
            .map(row -> codec.deserialize(row.getEventType(), row.getPayload()))
            .toList();
        long lastSeqNo = rows.get(rows.size() - 1).getSeqNo();

        return new EventHistory(events, lastSeqNo);
    }

    @Override
    @Transactional
    public long append(UUID accountId, long expectedSeqNo, AccountEvent event) {
        if (!accountId.equals(event.id())) {
            throw new IllegalArgumentException(
                "Event for account " + event.id() + " cannot be appended to account " + accountId);
        }

        long seqNo = expectedSeqNo + 1;
        StoredEvent stored = StoredEvent.create(accountId, seqNo, event.eventType(), codec.serialize(event));

        try {
            repository.saveAndFlush(AccountEventEntity.fromDomain(stored));
        } catch (DataIntegrityViolationException e) {
            throw new ConcurrentAppendException(accountId, seqNo, e);
        }

        log.debug("Appended event: type={}, accountId={}, seqNo={}", event.eventType(), accountId, seqNo);
        return seqNo;
    }

    /**
     * Counts events not yet relayed (for monitoring).
     */
    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }
}
