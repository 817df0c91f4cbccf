package com.flagship.account_ledger.eventlog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.account_ledger.observability.EventLogMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Relays appended events from the event log to Kafka, where the projection consumes them.
 *
 * Per-account order is what the projection relies on, so:
 * - events are read in global append order and keyed by account id (one partition per account)
 * - each send is awaited before the next one
 * - once an event of an account fails, the rest of that account's events in the batch
 *   wait for a later poll
 * - an account whose oldest pending event reached the retry limit is dead-lettered: none of
 *   its events are selected any more, so it cannot fill the batch and stall other accounts
 *
 * A batch runs in one transaction so its rows stay locked until they are marked.
 * Only one relay per database is expected to run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventLogRelay {

    private final AccountEventRepository repository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final EventLogMetrics eventLogMetrics;

    @Value("${kafka.topic.accounts:accounts}")
    private String accountsTopic;

    @Value("${relay.batch-size:100}")
    private int batchSize;

    @Value("${relay.max-retries:5}")
    private int maxRetries;

    /**
     * Relays one batch of pending events.
     *
     * @return number of events published
     */
    @Transactional
    public int publishPendingEvents() {
        List<AccountEventEntity> batch = repository.findUnpublishedForUpdate(batchSize, maxRetries);
        if (batch.isEmpty()) {
            return 0;
        }

        log.debug("Found {} unpublished events to relay", batch.size());

        Set<UUID> blockedAccounts = new HashSet<>();
        int published = 0;

        for (AccountEventEntity event : batch) {
            if (blockedAccounts.contains(event.getAccountId())) {
                continue;
            }
            if (publish(event)) {
                published++;
            } else {
                blockedAccounts.add(event.getAccountId());
            }
        }

        return published;
    }

    private boolean publish(AccountEventEntity event) {
        String key = event.getAccountId().toString();

        try {
            String value = toEnvelopeJson(event);
            SendResult<String, String> result = kafkaTemplate.send(accountsTopic, key, value).get();

            log.debug("Relayed event: seqId={}, seqNo={}, partition={}, offset={}, eventType={}",
                    event.getSeqId(),
                    event.getSeqNo(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            event.markPublished();
            eventLogMetrics.recordEventPublished(event.getEventType());
            return true;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, e);
            return false;
        } catch (Exception e) {
            recordFailure(event, e);
            return false;
        }
    }

    private void recordFailure(AccountEventEntity event, Exception e) {
        log.error("Failed to relay event: seqId={}, eventType={}, accountId={}, error={}",
                event.getSeqId(), event.getEventType(), event.getAccountId(), e.getMessage(), e);
        event.markFailed(e.getMessage());
        eventLogMetrics.recordEventPublishFailed(event.getEventType());

        if (event.getRetryCount() >= maxRetries) {
            log.warn("Event reached max retries ({}), account held back until it is repaired: seqId={}, seqNo={}, accountId={}",
                    maxRetries, event.getSeqId(), event.getSeqNo(), event.getAccountId());
            eventLogMetrics.recordEventDeadLettered(event.getEventType());
        }
    }

    private String toEnvelopeJson(AccountEventEntity event) throws JsonProcessingException {
        EventEnvelope envelope = new EventEnvelope(
            event.getSeqNo(),
            event.getAccountId(),
            event.getEventType(),
            objectMapper.readTree(event.getPayload())
        );
        return objectMapper.writeValueAsString(envelope);
    }
}
