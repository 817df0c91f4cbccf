package com.flagship.account_ledger.account.command;

import com.flagship.account_ledger.account.event.AccountEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of deciding a command: exactly one event to append, or a rejection.
 */
public final class Decision {

    private final AccountEvent event;
    private final AccountRejection rejection;

    private Decision(AccountEvent event, AccountRejection rejection) {
        this.event = event;
        this.rejection = rejection;
    }

    public static Decision emit(AccountEvent event) {
        return new Decision(Objects.requireNonNull(event), null);
    }

    public static Decision reject(AccountRejection rejection) {
        return new Decision(null, Objects.requireNonNull(rejection));
    }

    public boolean isRejected() {
        return rejection != null;
    }

    public Optional<AccountEvent> event() {
        return Optional.ofNullable(event);
    }

    public Optional<AccountRejection> rejection() {
        return Optional.ofNullable(rejection);
    }

    @Override
    public String toString() {
        return isRejected() ? "Decision[reject=" + rejection + "]" : "Decision[emit=" + event + "]";
    }
}
