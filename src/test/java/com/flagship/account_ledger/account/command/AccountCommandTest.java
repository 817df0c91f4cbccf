package com.flagship.account_ledger.account.command;

import com.flagship.account_ledger.account.AccountState;
import com.flagship.account_ledger.account.event.AccountCreatedEvent;
import com.flagship.account_ledger.account.event.AccountDepositedEvent;
import com.flagship.account_ledger.account.event.AccountEvent;
import com.flagship.account_ledger.account.event.AccountWithdrawnEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for command decisions.
 *
 * These tests verify that:
 * - each command emits the expected event, carrying the post-state balance
 * - business-rule violations come back as rejections, not exceptions
 * - a random mix of commands never drives the balance below zero
 */
class AccountCommandTest {

    private final UUID id = UUID.randomUUID();

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    @Test
    @DisplayName("Create on a nonexistent account emits AccountCreated")
    void testCreate_Nonexistent() {
        Decision decision = new AccountCommand.CreateAccount().decide(id, AccountState.NONEXISTENT);

        assertFalse(decision.isRejected());
        assertEquals(new AccountCreatedEvent(id), decision.event().orElseThrow());
    }

    @Test
    @DisplayName("Create on an existing account is rejected with AlreadyExists")
    void testCreate_Twice() {
        Decision decision = new AccountCommand.CreateAccount().decide(id, new AccountState.Existing(0));

        assertTrue(decision.isRejected());
        assertEquals(new AccountRejection.AlreadyExists(id), decision.rejection().orElseThrow());
        assertTrue(decision.event().isEmpty());
    }

    @Test
    @DisplayName("Deposit then withdraw carries the resulting balances")
    void testDepositThenWithdraw() {
        printTestHeader("Deposit then withdraw");

        AccountState state = new AccountState.Existing(0);

        AccountEvent deposited = new AccountCommand.Deposit(100).decide(id, state).event().orElseThrow();
        assertEquals(new AccountDepositedEvent(id, 100, 100), deposited);
        state = state.apply(deposited);

        AccountEvent withdrawn = new AccountCommand.Withdraw(40).decide(id, state).event().orElseThrow();
        assertEquals(new AccountWithdrawnEvent(id, 40, 60), withdrawn);
        state = state.apply(withdrawn);

        System.out.println("OUTPUT - Final state: " + state);
        assertEquals(new AccountState.Existing(60), state);
    }

    @Test
    @DisplayName("Withdrawing more than the balance is rejected with InsufficientBalance")
    void testWithdraw_InsufficientBalance() {
        Decision decision = new AccountCommand.Withdraw(51).decide(id, new AccountState.Existing(50));

        assertEquals(new AccountRejection.InsufficientBalance(id), decision.rejection().orElseThrow());
    }

    @Test
    @DisplayName("Withdrawing exactly the balance leaves zero")
    void testWithdraw_WholeBalance() {
        Decision decision = new AccountCommand.Withdraw(50).decide(id, new AccountState.Existing(50));

        assertEquals(new AccountWithdrawnEvent(id, 50, 0), decision.event().orElseThrow());
    }

    @Test
    @DisplayName("Deposit and withdraw on an unknown id are rejected with NotFound")
    void testUnknownId() {
        Decision deposit = new AccountCommand.Deposit(1).decide(id, AccountState.NONEXISTENT);
        Decision withdraw = new AccountCommand.Withdraw(1).decide(id, AccountState.NONEXISTENT);

        assertEquals(new AccountRejection.NotFound(id), deposit.rejection().orElseThrow());
        assertEquals(new AccountRejection.NotFound(id), withdraw.rejection().orElseThrow());
    }

    @Test
    @DisplayName("Deposit that would exceed Long.MAX_VALUE is rejected with BalanceOverflow")
    void testDeposit_Overflow() {
        AccountState state = new AccountState.Existing(Long.MAX_VALUE - 10);

        Decision decision = new AccountCommand.Deposit(11).decide(id, state);
        assertEquals(new AccountRejection.BalanceOverflow(id), decision.rejection().orElseThrow());

        Decision exact = new AccountCommand.Deposit(10).decide(id, state);
        assertEquals(new AccountDepositedEvent(id, 10, Long.MAX_VALUE), exact.event().orElseThrow());
    }

    @Test
    @DisplayName("Zero amounts are accepted and leave the balance unchanged")
    void testZeroAmounts() {
        AccountState state = new AccountState.Existing(7);

        assertEquals(new AccountDepositedEvent(id, 0, 7),
            new AccountCommand.Deposit(0).decide(id, state).event().orElseThrow());
        assertEquals(new AccountWithdrawnEvent(id, 0, 7),
            new AccountCommand.Withdraw(0).decide(id, state).event().orElseThrow());
    }

    @Test
    @DisplayName("Negative amounts cannot be expressed")
    void testNegativeAmounts() {
        assertThrows(IllegalArgumentException.class, () -> new AccountCommand.Deposit(-1));
        assertThrows(IllegalArgumentException.class, () -> new AccountCommand.Withdraw(-1));
    }

    @Test
    @DisplayName("Rejection messages name the account")
    void testRejectionMessages() {
        assertEquals("account with ID " + id + " not found", new AccountRejection.NotFound(id).message());
        assertEquals("account with ID " + id + " already exists", new AccountRejection.AlreadyExists(id).message());
        assertEquals("account with ID " + id + " has insufficient balance for withdrawal",
            new AccountRejection.InsufficientBalance(id).message());
    }

    @Test
    @DisplayName("Random command sequences keep the balance non-negative and replay to the same state")
    void testRandomSequences() {
        printTestHeader("Random command sequences");

        Random random = new Random(20240501L);

        for (int run = 0; run < 200; run++) {
            AccountState state = AccountState.NONEXISTENT;
            List<AccountEvent> events = new ArrayList<>();

            for (int step = 0; step < 50; step++) {
                AccountCommand command = randomCommand(random);
                Decision decision = command.decide(id, state);

                // deciding twice gives the same outcome
                assertEquals(decision.event(), command.decide(id, state).event());
                assertEquals(decision.rejection(), command.decide(id, state).rejection());

                if (decision.isRejected()) {
                    continue;
                }
                AccountEvent event = decision.event().orElseThrow();
                state = state.apply(event);
                events.add(event);

                if (state instanceof AccountState.Existing existing) {
                    assertTrue(existing.balance() >= 0, "balance went negative: " + existing);
                }
            }

            assertEquals(state, AccountState.replay(events));
        }
        System.out.println("✓ SUCCESS: 200 sequences checked");
    }

    private static AccountCommand randomCommand(Random random) {
        switch (random.nextInt(5)) {
            case 0:
                return new AccountCommand.CreateAccount();
            case 1:
            case 2:
                return new AccountCommand.Deposit(random.nextInt(1_000));
            default:
                return new AccountCommand.Withdraw(random.nextInt(1_500));
        }
    }
}
