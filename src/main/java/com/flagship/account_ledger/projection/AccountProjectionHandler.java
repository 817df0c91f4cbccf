package com.flagship.account_ledger.projection;

import com.flagship.account_ledger.account.event.AccountCreatedEvent;
import com.flagship.account_ledger.account.event.AccountDepositedEvent;
import com.flagship.account_ledger.account.event.AccountEvent;
import com.flagship.account_ledger.account.event.AccountWithdrawnEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Mirrors account events into the {@code account} read-model table.
 *
 * - Created: insert (id, 0); an existing row is left alone
 * - Deposited / Withdrawn: overwrite the balance with the one carried by the event
 *
 * Balances are copied from the event, never recomputed from amounts, so every write is
 * an overwrite and handling the same event twice leaves the same row. Must run in the
 * caller's transaction; database errors propagate and are not retried here. A balance
 * event for an account without a row is an error, so the listener stops on it instead
 * of moving past a lost Created event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccountProjectionHandler {

    private final JdbcTemplate jdbcTemplate;

    @Transactional(propagation = Propagation.MANDATORY)
    public void handle(AccountEvent event) {
        if (event instanceof AccountCreatedEvent created) {
            insert(created.id());
        } else if (event instanceof AccountDepositedEvent deposited) {
            updateBalance(deposited.id(), deposited.balance());
            log.info("Account updated with deposited amount: accountId={}, amount={}",
                    deposited.id(), deposited.amount());
        } else if (event instanceof AccountWithdrawnEvent withdrawn) {
            updateBalance(withdrawn.id(), withdrawn.balance());
            log.info("Account updated with withdrawn amount: accountId={}, amount={}",
                    withdrawn.id(), withdrawn.amount());
        }
    }

    private void insert(UUID id) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO account (id, balance) VALUES (?, 0) ON CONFLICT (id) DO NOTHING",
            id
        );
        if (inserted == 0) {
            log.debug("Account {} already in read-model, Created event ignored", id);
        } else {
            log.info("Inserted account: accountId={}", id);
        }
    }

    private void updateBalance(UUID id, long balance) {
        int updated = jdbcTemplate.update(
            "UPDATE account SET balance = ? WHERE id = ?",
            balance,
            id
        );
        if (updated == 0) {
            // the Created event of this account never reached the read-model
            throw new IllegalStateException("No read-model row for account " + id);
        }
    }
}
