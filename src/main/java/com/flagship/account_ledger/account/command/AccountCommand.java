package com.flagship.account_ledger.account.command;

import com.flagship.account_ledger.account.AccountState;
import com.flagship.account_ledger.account.event.AccountCreatedEvent;
import com.flagship.account_ledger.account.event.AccountDepositedEvent;
import com.flagship.account_ledger.account.event.AccountWithdrawnEvent;

import java.util.UUID;

/**
 * Commands accepted by an account.
 *
 * Each command decides against the current state and either proposes one event for
 * the event log or rejects. Deciding never touches storage; appending the event and
 * applying it is the entity runtime's job.
 */
public sealed interface AccountCommand
        permits AccountCommand.CreateAccount, AccountCommand.Deposit, AccountCommand.Withdraw {

    /**
     * @param id    the account id the command is addressed to
     * @param state current state, rebuilt from the event log
     */
    Decision decide(UUID id, AccountState state);

    /**
     * Short name used for logs and metric tags.
     */
    String name();

    /**
     * Opens a new account. Only valid once per id.
     */
    record CreateAccount() implements AccountCommand {

        @Override
        public Decision decide(UUID id, AccountState state) {
            if (state instanceof AccountState.Existing) {
                return Decision.reject(new AccountRejection.AlreadyExists(id));
            }
            return Decision.emit(new AccountCreatedEvent(id));
        }

        @Override
        public String name() {
            return "create_account";
        }
    }

    /**
     * Adds {@code amount} to the balance. Sums above {@link Long#MAX_VALUE} are rejected.
     */
    record Deposit(long amount) implements AccountCommand {

        public Deposit {
            requireNonNegative(amount);
        }

        @Override
        public Decision decide(UUID id, AccountState state) {
            if (!(state instanceof AccountState.Existing existing)) {
                return Decision.reject(new AccountRejection.NotFound(id));
            }
            long balance;
            try {
                balance = Math.addExact(existing.balance(), amount);
            } catch (ArithmeticException e) {
                return Decision.reject(new AccountRejection.BalanceOverflow(id));
            }
            return Decision.emit(new AccountDepositedEvent(id, amount, balance));
        }

        @Override
        public String name() {
            return "deposit";
        }
    }

    /**
     * Takes {@code amount} from the balance; the balance never goes below zero.
     */
    record Withdraw(long amount) implements AccountCommand {

        public Withdraw {
            requireNonNegative(amount);
        }

        @Override
        public Decision decide(UUID id, AccountState state) {
            if (!(state instanceof AccountState.Existing existing)) {
                return Decision.reject(new AccountRejection.NotFound(id));
            }
            if (amount > existing.balance()) {
                return Decision.reject(new AccountRejection.InsufficientBalance(id));
            }
            return Decision.emit(new AccountWithdrawnEvent(id, amount, existing.balance() - amount));
        }

        @Override
        public String name() {
            return "withdraw";
        }
    }

    private static void requireNonNegative(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
    }
}
