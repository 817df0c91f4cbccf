package com.flagship.account_ledger.projection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.account_ledger.account.event.AccountEvent;
import com.flagship.account_ledger.eventlog.AccountEventCodec;
import com.flagship.account_ledger.eventlog.EventEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer that feeds relayed account events into the read-model projection.
 *
 * Offsets are acknowledged only after the projection transaction commits. A record
 * that fails is not acknowledged and the error is rethrown, so the listener container
 * redelivers it; the per-account cursor makes the redelivery safe.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AccountEventConsumer {

    private final AccountProjectionService projectionService;
    private final AccountEventCodec eventCodec;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.accounts:accounts}",
        groupId = "${spring.kafka.consumer.group-id:account-projection}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        try {
            EventEnvelope envelope = objectMapper.readValue(record.value(), EventEnvelope.class);
            AccountEvent event = eventCodec.deserialize(envelope.eventType(), envelope.payload());

            boolean applied = projectionService.project(envelope.seqNo(), event);
            ack.acknowledge();

            if (applied) {
                log.info("Projected event: type={}, accountId={}, seqNo={}",
                        envelope.eventType(), envelope.accountId(), envelope.seqNo());
            }

        } catch (JsonProcessingException e) {
            log.error("Could not parse event at offset {}: {}", record.offset(), e.getMessage(), e);
            throw new IllegalArgumentException("Unreadable event envelope at offset " + record.offset(), e);
        } catch (RuntimeException e) {
            log.error("Error projecting message at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        }
    }
}
