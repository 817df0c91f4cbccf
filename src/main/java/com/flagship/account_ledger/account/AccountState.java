package com.flagship.account_ledger.account;

import com.flagship.account_ledger.account.event.AccountCreatedEvent;
import com.flagship.account_ledger.account.event.AccountDepositedEvent;
import com.flagship.account_ledger.account.event.AccountEvent;
import com.flagship.account_ledger.account.event.AccountWithdrawnEvent;

import java.util.List;

/**
 * State of an account aggregate, derived only from its events.
 *
 * State machine:
 * - NONEXISTENT + Created -> EXISTING(balance = 0)
 * - EXISTING + Deposited/Withdrawn -> EXISTING(balance = event balance)
 *
 * Any other combination means the event log is corrupt or a decision was wrong.
 * It is never turned into a normal error: {@link #apply} throws {@link InvalidEventError}.
 */
public sealed interface AccountState permits AccountState.Nonexistent, AccountState.Existing {

    /**
     * Initial state of every account id before its Created event.
     */
    Nonexistent NONEXISTENT = new Nonexistent();

    /**
     * Returns the state after {@code event}. Pure: same inputs, same result, no side effects.
     *
     * @throws InvalidEventError if the event is not valid in this state
     */
    AccountState apply(AccountEvent event);

    /**
     * Folds {@code events} over the initial state.
     */
    static AccountState replay(List<? extends AccountEvent> events) {
        AccountState state = NONEXISTENT;
        for (AccountEvent event : events) {
            state = state.apply(event);
        }
        return state;
    }

    /**
     * No account has been created for this id yet.
     */
    final class Nonexistent implements AccountState {

        private Nonexistent() {
        }

        @Override
        public AccountState apply(AccountEvent event) {
            if (event instanceof AccountCreatedEvent) {
                return new Existing(0);
            }
            throw new InvalidEventError(event, this);
        }

        @Override
        public String toString() {
            return "Nonexistent";
        }
    }

    /**
     * An active account.
     */
    record Existing(long balance) implements AccountState {

        public Existing {
            if (balance < 0) {
                throw new IllegalArgumentException("Balance must not be negative: " + balance);
            }
        }

        @Override
        public AccountState apply(AccountEvent event) {
            if (event instanceof AccountDepositedEvent deposited) {
                return new Existing(deposited.balance());
            }
            if (event instanceof AccountWithdrawnEvent withdrawn) {
                return new Existing(withdrawn.balance());
            }
            throw new InvalidEventError(event, this);
        }
    }
}
