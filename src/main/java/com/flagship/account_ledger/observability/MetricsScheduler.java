package com.flagship.account_ledger.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes gauges that need database queries, so a Prometheus scrape
 * never hits the database.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final EventLogMetrics eventLogMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshEventLogMetrics() {
        eventLogMetrics.refreshMetrics();
    }
}
