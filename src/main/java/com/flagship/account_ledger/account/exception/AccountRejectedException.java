package com.flagship.account_ledger.account.exception;

import com.flagship.account_ledger.account.command.AccountRejection;

/**
 * Thrown by the entity runtime when a command is rejected by its decision.
 * No event was appended.
 */
public class AccountRejectedException extends RuntimeException {

    private final transient AccountRejection rejection;

    public AccountRejectedException(AccountRejection rejection) {
        super(rejection.message());
        this.rejection = rejection;
    }

    public AccountRejection getRejection() {
        return rejection;
    }
}
