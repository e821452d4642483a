package com.flagship.wallet_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled a ledger event.
 *
 * Kafka may redeliver after a rebalance or a crash before the offset commit;
 * the relay checks these records so a change reaches subscribers once.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String accountId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String accountId, String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, accountId, consumerGroup,
                Instant.now(), ProcessingResult.SUCCESS, null);
    }
}
