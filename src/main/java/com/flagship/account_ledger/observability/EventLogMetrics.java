package com.flagship.account_ledger.observability;

import com.flagship.account_ledger.eventlog.AccountEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the event log relay.
 *
 * - eventlog.backlog.size: events not yet relayed to Kafka
 * - eventlog.backlog.age.seconds: age of the oldest of them, an upper bound of projection lag
 * - eventlog.events.failed: events that exceeded the retry limit
 *
 * Gauges read cached values refreshed by {@link MetricsScheduler}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventLogMetrics {

    private final AccountEventRepository eventRepository;
    private final MeterRegistry meterRegistry;

    @Value("${relay.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong failedEventCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("eventlog.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of events not yet relayed to Kafka")
                .register(meterRegistry);

        Gauge.builder("eventlog.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest event not yet relayed, in seconds")
                .register(meterRegistry);

        Gauge.builder("eventlog.events.failed", failedEventCount, AtomicLong::get)
                .description("Number of events that exceeded max relay attempts")
                .register(meterRegistry);

        log.info("Event log metrics registered with Micrometer");
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long unpublished = eventRepository.countUnpublished();
            backlogSize.set(unpublished);

            eventRepository.findOldestUnpublishedCreatedAt()
                    .ifPresentOrElse(
                            oldest -> oldestEventAgeSeconds.set(
                                    Math.max(0, Duration.between(oldest, Instant.now()).getSeconds())),
                            () -> oldestEventAgeSeconds.set(0)
                    );

            long failed = eventRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries);
            failedEventCount.set(failed);

            log.debug("Event log metrics refreshed: backlog={}, oldestAge={}s, failed={}",
                    unpublished, oldestEventAgeSeconds.get(), failed);

        } catch (Exception e) {
            log.warn("Failed to refresh event log metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("eventlog.events.relayed",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("eventlog.events.relayed",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("eventlog.events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}
