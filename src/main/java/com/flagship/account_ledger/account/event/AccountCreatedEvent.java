package com.flagship.account_ledger.account.event;

import java.util.UUID;

/**
 * Event recorded when an account comes into existence with a zero balance.
 */
public record AccountCreatedEvent(UUID id) implements AccountEvent {

    public static final String EVENT_TYPE = "AccountCreated";

    @Override
    public String eventType() {
        return EVENT_TYPE;
    }
}
