package com.flagship.wallet_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the outbox for delivery to Kafka.
 *
 * Written in the same database transaction as the balance or log change it
 * describes, so a committed change always has a matching pending event.
 * The aggregate is always the account; its id doubles as the Kafka key.
 */
@Value
public class OutboxEvent {
    public static final String ACCOUNT_AGGREGATE = "Account";

    UUID id;
    String aggregateType;
    String accountId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int attempts;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent pending(UUID eventId, String accountId, String eventType, String payload) {
        return new OutboxEvent(
            eventId,
            ACCOUNT_AGGREGATE,
            accountId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * True once delivery has failed often enough that the publisher gives up.
     */
    public boolean hasExhausted(int maxAttempts) {
        return attempts >= maxAttempts;
    }
}
