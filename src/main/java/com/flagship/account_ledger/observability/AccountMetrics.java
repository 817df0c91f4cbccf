package com.flagship.account_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for account commands and the projection.
 *
 * Metrics exposed:
 * - account.commands: counter tagged with command and outcome (accepted, rejected, error)
 * - account.command.duration: timer tagged with command
 * - account.projection.events: counter tagged with event type and result (applied, skipped)
 */
@Component
public class AccountMetrics {

    private final MeterRegistry registry;

    public AccountMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCommand(String command, String outcome) {
        registry.counter("account.commands",
                "command", command,
                "outcome", outcome
        ).increment();
    }

    public void recordCommandLatency(String command, long durationMs) {
        Timer.builder("account.command.duration")
                .description("Time taken to decide and append an account command")
                .tag("command", command)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordProjected(String eventType, String result) {
        registry.counter("account.projection.events",
                "event_type", eventType,
                "result", result
        ).increment();
    }
}
