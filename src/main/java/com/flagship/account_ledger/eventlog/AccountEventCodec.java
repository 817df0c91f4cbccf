package com.flagship.account_ledger.eventlog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.account_ledger.account.event.AccountCreatedEvent;
import com.flagship.account_ledger.account.event.AccountDepositedEvent;
import com.flagship.account_ledger.account.event.AccountEvent;
import com.flagship.account_ledger.account.event.AccountWithdrawnEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON codec for account events. The event type name selects the payload class.
 */
@Component
@RequiredArgsConstructor
public class AccountEventCodec {

    private final ObjectMapper objectMapper;

    public String serialize(AccountEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event " + event.eventType(), e);
        }
    }

    public AccountEvent deserialize(String eventType, String payload) {
        try {
            return deserialize(eventType, objectMapper.readTree(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize event " + eventType + ": " + e.getMessage(), e);
        }
    }

    public AccountEvent deserialize(String eventType, JsonNode payload) {
        Class<? extends AccountEvent> type = typeOf(eventType);
        try {
            return objectMapper.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize event " + eventType + ": " + e.getMessage(), e);
        }
    }

    private Class<? extends AccountEvent> typeOf(String eventType) {
        return switch (eventType) {
            case AccountCreatedEvent.EVENT_TYPE -> AccountCreatedEvent.class;
            case AccountDepositedEvent.EVENT_TYPE -> AccountDepositedEvent.class;
            case AccountWithdrawnEvent.EVENT_TYPE -> AccountWithdrawnEvent.class;
            default -> throw new IllegalArgumentException("Unknown event type: " + eventType);
        };
    }
}
