package com.flagship.account_ledger.account.event;

import java.util.UUID;

/**
 * Event recorded when money is deposited.
 *
 * {@code balance} is the balance after the deposit, computed when the command was
 * decided. Replay and projection copy it as is.
 */
public record AccountDepositedEvent(UUID id, long amount, long balance) implements AccountEvent {

    public static final String EVENT_TYPE = "AccountDeposited";

    @Override
    public String eventType() {
        return EVENT_TYPE;
    }
}
