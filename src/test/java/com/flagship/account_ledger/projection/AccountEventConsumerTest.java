package com.flagship.account_ledger.projection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.account_ledger.account.event.AccountDepositedEvent;
import com.flagship.account_ledger.config.JacksonConfig;
import com.flagship.account_ledger.eventlog.AccountEventCodec;
import com.flagship.account_ledger.eventlog.EventEnvelope;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.kafka.support.Acknowledgment;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Tests for the projection listener's acknowledgment rules: an offset is acknowledged
 * only after the event was projected (or found already projected).
 */
@ExtendWith(MockitoExtension.class)
class AccountEventConsumerTest {

    @Mock
    private AccountProjectionService projectionService;

    @Mock
    private Acknowledgment ack;

    private ObjectMapper objectMapper;
    private AccountEventConsumer consumer;

    @BeforeEach
    void setUp() {
        objectMapper = new JacksonConfig().objectMapper();
        consumer = new AccountEventConsumer(projectionService, new AccountEventCodec(objectMapper), objectMapper);
    }

    @Test
    @DisplayName("Projected event is acknowledged")
    void testProjectedEvent_Acknowledged() throws Exception {
        UUID id = UUID.randomUUID();
        AccountDepositedEvent event = new AccountDepositedEvent(id, 10, 10);
        when(projectionService.project(2L, event)).thenReturn(true);

        consumer.consume(record(id, 2L, event), ack);

        verify(projectionService).project(2L, event);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Already projected event is acknowledged as well")
    void testDuplicateEvent_Acknowledged() throws Exception {
        UUID id = UUID.randomUUID();
        AccountDepositedEvent event = new AccountDepositedEvent(id, 10, 10);
        when(projectionService.project(2L, event)).thenReturn(false);

        consumer.consume(record(id, 2L, event), ack);

        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Projection failure is rethrown and not acknowledged")
    void testProjectionFailure_NotAcknowledged() throws Exception {
        UUID id = UUID.randomUUID();
        AccountDepositedEvent event = new AccountDepositedEvent(id, 10, 10);
        when(projectionService.project(anyLong(), any()))
            .thenThrow(new DataAccessResourceFailureException("database down"));

        ConsumerRecord<String, String> record = record(id, 2L, event);
        assertThrows(DataAccessResourceFailureException.class, () -> consumer.consume(record, ack));

        verify(ack, never()).acknowledge();
    }

    @Test
    @DisplayName("Unreadable message is rethrown and not acknowledged")
    void testUnreadableMessage_NotAcknowledged() {
        ConsumerRecord<String, String> record = new ConsumerRecord<>("accounts", 0, 7L, "key", "not json");

        assertThrows(IllegalArgumentException.class, () -> consumer.consume(record, ack));

        verifyNoInteractions(projectionService);
        verify(ack, never()).acknowledge();
    }

    @Test
    @DisplayName("Unknown event type is rethrown and not acknowledged")
    void testUnknownEventType_NotAcknowledged() throws Exception {
        UUID id = UUID.randomUUID();
        EventEnvelope envelope = new EventEnvelope(1L, id, "AccountClosed",
            objectMapper.readTree("{\"id\":\"" + id + "\"}"));
        ConsumerRecord<String, String> record = new ConsumerRecord<>("accounts", 0, 8L, id.toString(),
            objectMapper.writeValueAsString(envelope));

        assertThrows(IllegalArgumentException.class, () -> consumer.consume(record, ack));

        verifyNoInteractions(projectionService);
        verify(ack, never()).acknowledge();
    }

    private ConsumerRecord<String, String> record(UUID id, long seqNo, AccountDepositedEvent event) throws Exception {
        EventEnvelope envelope = new EventEnvelope(seqNo, id, event.eventType(), objectMapper.valueToTree(event));
        return new ConsumerRecord<>("accounts", 0, seqNo, id.toString(), objectMapper.writeValueAsString(envelope));
    }
}
