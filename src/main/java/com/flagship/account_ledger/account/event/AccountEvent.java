package com.flagship.account_ledger.account.event;

import java.util.UUID;

/**
 * Base type for account events.
 *
 * Events are immutable facts, appended to the event log in the order they were
 * decided and never changed afterwards. Replaying them from the start yields the
 * current state of the account.
 */
public sealed interface AccountEvent
        permits AccountCreatedEvent, AccountDepositedEvent, AccountWithdrawnEvent {

    /**
     * The account this event is about.
     */
    UUID id();

    /**
     * Event type name, stored next to the JSON payload in the event log.
     */
    String eventType();
}
