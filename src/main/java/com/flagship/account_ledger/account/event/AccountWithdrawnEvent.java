package com.flagship.account_ledger.account.event;

import java.util.UUID;

/**
 * Event recorded when money is withdrawn. {@code balance} is the post-withdrawal balance.
 */
public record AccountWithdrawnEvent(UUID id, long amount, long balance) implements AccountEvent {

    public static final String EVENT_TYPE = "AccountWithdrawn";

    @Override
    public String eventType() {
        return EVENT_TYPE;
    }
}
