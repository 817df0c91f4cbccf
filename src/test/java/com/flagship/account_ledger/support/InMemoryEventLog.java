package com.flagship.account_ledger.support;

import com.flagship.account_ledger.account.event.AccountEvent;
import com.flagship.account_ledger.eventlog.ConcurrentAppendException;
import com.flagship.account_ledger.eventlog.EventHistory;
import com.flagship.account_ledger.eventlog.EventLog;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Event log kept in memory, with the same sequence-number check as the database one.
 */
public class InMemoryEventLog implements EventLog {

    private final Map<UUID, List<AccountEvent>> events = new HashMap<>();
    private volatile RuntimeException failNextAppend;

    @Override
    public synchronized EventHistory load(UUID accountId) {
        List<AccountEvent> history = events.getOrDefault(accountId, List.of());
        return new EventHistory(List.copyOf(history), history.size());
    }

    @Override
    public synchronized long append(UUID accountId, long expectedSeqNo, AccountEvent event) {
        if (failNextAppend != null) {
            RuntimeException failure = failNextAppend;
            failNextAppend = null;
            throw failure;
        }
        List<AccountEvent> history = events.computeIfAbsent(accountId, id -> new ArrayList<>());
        if (history.size() != expectedSeqNo) {
            throw new ConcurrentAppendException(accountId, expectedSeqNo + 1, null);
        }
        history.add(event);
        return history.size();
    }

    /**
     * Puts events into the log without any check, e.g. to simulate a corrupt history.
     */
    public synchronized void seed(UUID accountId, AccountEvent... seeded) {
        List<AccountEvent> history = events.computeIfAbsent(accountId, id -> new ArrayList<>());
        history.addAll(List.of(seeded));
    }

    public void failNextAppend(RuntimeException failure) {
        this.failNextAppend = failure;
    }

    public synchronized List<AccountEvent> eventsOf(UUID accountId) {
        return List.copyOf(events.getOrDefault(accountId, List.of()));
    }
}
