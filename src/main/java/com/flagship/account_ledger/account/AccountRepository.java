package com.flagship.account_ledger.account;

import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Read-only access to the account read-model.
 *
 * The read-model is filled by the projection and lags behind the event log, so a
 * read right after a command may not reflect it yet.
 */
public interface AccountRepository {

    /**
     * All accounts, ordered by id (ids are time-ordered, so this is creation order).
     *
     * The stream is lazy and holds a database connection until closed: use it in a
     * try-with-resources block. Every call starts a fresh scan.
     */
    Stream<Account> accounts();

    /**
     * The account with the given id; empty if there is none, which is not an error.
     */
    Optional<Account> accountById(UUID id);
}
