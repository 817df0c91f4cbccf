package com.flagship.account_ledger.account;

import lombok.Value;

import java.util.UUID;

/**
 * An account as seen by readers: one row of the read-model, or the reply to a command.
 *
 * Balances are kept in {@code 0 .. Long.MAX_VALUE}; the storage column is a signed BIGINT.
 */
@Value
public class Account {
    UUID id;
    long balance;

    /**
     * Builds the reply for an account that exists after a command was applied.
     *
     * @throws IllegalStateException if the state is not {@link AccountState.Existing}
     */
    public static Account from(UUID id, AccountState state) {
        if (state instanceof AccountState.Existing existing) {
            return new Account(id, existing.balance());
        }
        throw new IllegalStateException("Account " + id + " does not exist after command: " + state);
    }
}
