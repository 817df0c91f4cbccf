package com.flagship.account_ledger.account.command;

import java.util.UUID;

/**
 * Expected business-rule outcomes that stop a command from producing an event.
 *
 * Rejections are not failures: they are reported to the caller and never retried.
 */
public sealed interface AccountRejection {

    UUID id();

    String message();

    record AlreadyExists(UUID id) implements AccountRejection {
        @Override
        public String message() {
            return "account with ID " + id + " already exists";
        }
    }

    record NotFound(UUID id) implements AccountRejection {
        @Override
        public String message() {
            return "account with ID " + id + " not found";
        }
    }

    record InsufficientBalance(UUID id) implements AccountRejection {
        @Override
        public String message() {
            return "account with ID " + id + " has insufficient balance for withdrawal";
        }
    }

    record BalanceOverflow(UUID id) implements AccountRejection {
        @Override
        public String message() {
            return "deposit would overflow the balance of account with ID " + id;
        }
    }
}
