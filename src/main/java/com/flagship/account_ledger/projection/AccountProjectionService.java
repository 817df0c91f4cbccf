package com.flagship.account_ledger.projection;

import com.flagship.account_ledger.account.event.AccountEvent;
import com.flagship.account_ledger.observability.AccountMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.OptionalLong;

/**
 * Applies one delivered event to the read-model and advances the account's cursor,
 * both in one transaction.
 *
 * A crash before commit loses both, so the event is delivered again. An event at or
 * below the cursor was already applied and is skipped; applying it again would be
 * harmless anyway, but skipping keeps a late redelivery from writing an older balance
 * over a newer one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountProjectionService {

    private final AccountProjectionHandler handler;
    private final ProjectionCursorRepository cursorRepository;
    private final AccountMetrics accountMetrics;

    /**
     * @return true if the event was applied, false if it was already projected
     */
    @Transactional
    public boolean project(long seqNo, AccountEvent event) {
        OptionalLong cursor = cursorRepository.findSeqNoForUpdate(event.id());
        if (cursor.isPresent() && seqNo <= cursor.getAsLong()) {
            log.info("Event already projected, skipping: accountId={}, seqNo={}, cursor={}",
                    event.id(), seqNo, cursor.getAsLong());
            accountMetrics.recordProjected(event.eventType(), "skipped");
            return false;
        }

        handler.handle(event);
        cursorRepository.advance(event.id(), seqNo);
        accountMetrics.recordProjected(event.eventType(), "applied");
        return true;
    }
}
