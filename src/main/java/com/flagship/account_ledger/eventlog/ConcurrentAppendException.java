package com.flagship.account_ledger.eventlog;

import java.util.UUID;

/**
 * An append lost the race for its sequence number: another writer appended to the
 * same account since the caller loaded it. This is an infrastructure failure; the
 * command may be retried against fresh state.
 */
public class ConcurrentAppendException extends RuntimeException {

    private final UUID accountId;
    private final long seqNo;

    public ConcurrentAppendException(UUID accountId, long seqNo, Throwable cause) {
        super("Sequence number " + seqNo + " of account " + accountId + " is already taken", cause);
        this.accountId = accountId;
        this.seqNo = seqNo;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public long getSeqNo() {
        return seqNo;
    }
}
