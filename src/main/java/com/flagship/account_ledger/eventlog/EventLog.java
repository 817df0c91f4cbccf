package com.flagship.account_ledger.eventlog;

import com.flagship.account_ledger.account.event.AccountEvent;

import java.util.UUID;

/**
 * Append-only, per-account ordered event log.
 *
 * Every event of an account carries a sequence number starting at 1. An append names
 * the sequence number it expects to follow; if another writer got there first the
 * append fails with {@link ConcurrentAppendException} and nothing is written.
 */
public interface EventLog {

    /**
     * Loads all events of an account in append order.
     */
    EventHistory load(UUID accountId);

    /**
     * Appends {@code event} right after {@code expectedSeqNo}.
     *
     * @param expectedSeqNo sequence number of the last event the caller has seen, 0 for none
     * @return the sequence number assigned to the event
     * @throws ConcurrentAppendException if {@code expectedSeqNo + 1} is already taken
     */
    long append(UUID accountId, long expectedSeqNo, AccountEvent event);
}
