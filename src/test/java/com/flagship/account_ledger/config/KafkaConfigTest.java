package com.flagship.account_ledger.config;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.MessageListenerContainer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the projection listener's error handler: a record that keeps failing must
 * never be recovered (skipped), however often it is retried.
 */
class KafkaConfigTest {

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    @Test
    @DisplayName("A record that keeps failing is retried and never skipped")
    void testFailingRecord_NeverSkipped() {
        printTestHeader("Failing record is never skipped");

        CommonErrorHandler errorHandler = new KafkaConfig().projectionErrorHandler(1L);
        ConsumerRecord<String, String> record = new ConsumerRecord<>("accounts", 0, 5L, "key", "value");
        Consumer<?, ?> consumer = mock(Consumer.class);
        MessageListenerContainer container = mock(MessageListenerContainer.class);
        when(container.isRunning()).thenReturn(true);

        // Spring Kafka's default handler gives up after 10 attempts
        for (int attempt = 1; attempt <= 50; attempt++) {
            boolean recovered = errorHandler.handleOne(
                new DataAccessResourceFailureException("database down"), record, consumer, container);
            assertFalse(recovered, "record was skipped at attempt " + attempt);
        }
        System.out.println("✓ SUCCESS: 50 attempts, record still pending");
    }

    @Test
    @DisplayName("The failing record is sought back to instead of being committed past")
    void testErrorHandler_SeeksAfterHandling() {
        CommonErrorHandler errorHandler = new KafkaConfig().projectionErrorHandler(1L);

        assertTrue(errorHandler.seeksAfterHandling());
    }
}
