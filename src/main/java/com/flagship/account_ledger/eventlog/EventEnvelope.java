package com.flagship.account_ledger.eventlog;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * Message relayed to Kafka for every appended event.
 *
 * @param seqNo     per-account sequence number of the event
 * @param accountId aggregate id, also used as the Kafka key
 * @param eventType event type name, selects the payload class
 * @param payload   the event itself
 */
public record EventEnvelope(long seqNo, UUID accountId, String eventType, JsonNode payload) {
}
