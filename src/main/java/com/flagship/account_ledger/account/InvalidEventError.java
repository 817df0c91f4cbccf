package com.flagship.account_ledger.account;

import com.flagship.account_ledger.account.event.AccountEvent;

/**
 * Raised when an event is applied to a state it is not valid for.
 *
 * This is an {@link Error}, not an exception: it means the event log is corrupt or
 * decision logic emitted an impossible event. Callers must not map it to a response;
 * the process is expected to stop (see FatalErrorHandler).
 */
public class InvalidEventError extends Error {

    private final transient AccountEvent event;
    private final transient AccountState state;

    public InvalidEventError(AccountEvent event, AccountState state) {
        super(String.format("Invalid event %s in state %s", event, state));
        this.event = event;
        this.state = state;
    }

    public AccountEvent getEvent() {
        return event;
    }

    public AccountState getState() {
        return state;
    }
}
