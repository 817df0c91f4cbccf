package com.flagship.account_ledger.eventlog;

import com.flagship.account_ledger.account.event.AccountEvent;
import lombok.Value;

import java.util.List;

/**
 * Events of one account as loaded from the log, with the sequence number of the last one.
 */
@Value
public class EventHistory {
    List<AccountEvent> events;
    long lastSeqNo;

    public static EventHistory empty() {
        return new EventHistory(List.of(), 0);
    }
}
