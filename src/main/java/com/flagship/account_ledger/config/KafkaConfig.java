package com.flagship.account_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Kafka configuration.
 *
 * Configures:
 * - the topic the relay publishes account events to (keyed by account id, so partitions
 *   only spread different accounts)
 * - the listener error handler for the projection
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.accounts:accounts}")
    private String accountsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic accountsTopic() {
        return TopicBuilder.name(accountsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    /**
     * Retries a failing record forever, seeking back to it after every attempt.
     *
     * The projection must see every event of an account in order, so a record is never
     * skipped: the partition stops until the record can be projected.
     */
    @Bean
    public CommonErrorHandler projectionErrorHandler(
            @Value("${consumer.retry-interval-ms:1000}") long retryIntervalMs) {
        return new DefaultErrorHandler(new FixedBackOff(retryIntervalMs, FixedBackOff.UNLIMITED_ATTEMPTS));
    }
}
