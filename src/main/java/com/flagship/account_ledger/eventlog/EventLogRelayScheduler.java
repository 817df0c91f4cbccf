package com.flagship.account_ledger.eventlog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls the event log at a fixed rate and hands pending events to the relay.
 * Disable with {@code relay.enabled=false} (tests trigger the relay by hand).
 */
@Component
@ConditionalOnProperty(name = "relay.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class EventLogRelayScheduler {

    private final EventLogRelay relay;

    @Scheduled(fixedDelayString = "${relay.poll-interval-ms:1000}")
    public void relayPendingEvents() {
        try {
            int published = relay.publishPendingEvents();
            if (published > 0) {
                log.debug("Relayed {} events", published);
            }
        } catch (Exception e) {
            log.error("Error in event log relay polling loop", e);
        }
    }
}
