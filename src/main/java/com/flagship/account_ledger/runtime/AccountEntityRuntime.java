package com.flagship.account_ledger.runtime;

import com.flagship.account_ledger.account.Account;
import com.flagship.account_ledger.account.AccountState;
import com.flagship.account_ledger.account.InvalidEventError;
import com.flagship.account_ledger.account.command.AccountCommand;
import com.flagship.account_ledger.account.command.AccountRejection;
import com.flagship.account_ledger.account.command.Decision;
import com.flagship.account_ledger.account.event.AccountEvent;
import com.flagship.account_ledger.account.exception.AccountRejectedException;
import com.flagship.account_ledger.eventlog.EventHistory;
import com.flagship.account_ledger.eventlog.EventLog;
import com.flagship.account_ledger.observability.AccountMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs commands against account aggregates.
 *
 * For one account id, exactly one command is in flight at a time:
 * 1. rebuild the state by replaying the account's events
 * 2. decide the command against that state
 * 3. append the resulting event (this is the commit point)
 * 4. apply the event and reply with the post-state
 *
 * A rejection appends nothing. An event that cannot be applied is a fatal fault and
 * is handed to the {@link FatalErrorHandler} before being rethrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountEntityRuntime {

    private final EventLog eventLog;
    private final FatalErrorHandler fatalErrorHandler;
    private final AccountMetrics accountMetrics;
    private final KeyedLocks<UUID> locks = new KeyedLocks<>();

    /**
     * Handles {@code command} for account {@code id}.
     *
     * @return the account after the command's event was appended and applied
     * @throws AccountRejectedException if the command was rejected
     */
    public Account handle(UUID id, AccountCommand command) {
        long startTime = System.currentTimeMillis();
        try {
            Account account = locks.withLock(id, () -> decideAndAppend(id, command));
            accountMetrics.recordCommand(command.name(), "accepted");
            return account;
        } catch (AccountRejectedException e) {
            accountMetrics.recordCommand(command.name(), "rejected");
            throw e;
        } catch (RuntimeException e) {
            accountMetrics.recordCommand(command.name(), "error");
            throw e;
        } finally {
            accountMetrics.recordCommandLatency(command.name(), System.currentTimeMillis() - startTime);
        }
    }

    private Account decideAndAppend(UUID id, AccountCommand command) {
        EventHistory history = eventLog.load(id);
        AccountState state = applyOrDie(id, () -> AccountState.replay(history.getEvents()));

        Decision decision = command.decide(id, state);
        if (decision.isRejected()) {
            AccountRejection rejection = decision.rejection().orElseThrow();
            log.info("Command rejected: command={}, accountId={}, rejection={}",
                    command.name(), id, rejection.getClass().getSimpleName());
            throw new AccountRejectedException(rejection);
        }

        AccountEvent event = decision.event().orElseThrow();
        long seqNo = eventLog.append(id, history.getLastSeqNo(), event);

        AccountState newState = applyOrDie(id, () -> state.apply(event));
        log.info("Command accepted: command={}, accountId={}, event={}, seqNo={}",
                command.name(), id, event.eventType(), seqNo);

        return Account.from(id, newState);
    }

    private AccountState applyOrDie(UUID id, Supplier<AccountState> application) {
        try {
            return application.get();
        } catch (InvalidEventError e) {
            fatalErrorHandler.onFatalError("invalid event for account " + id, e);
            throw e;
        }
    }
}
