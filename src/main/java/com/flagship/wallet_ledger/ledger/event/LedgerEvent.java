package com.flagship.wallet_ledger.ledger.event;

import com.flagship.wallet_ledger.store.LedgerChange;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events published to Kafka through the outbox.
 *
 * All ledger events share these common properties:
 * - Event ID for deduplication
 * - Account ID (aggregate ID and Kafka key)
 * - Instance that committed the change
 * - Timestamp of when the event occurred
 */
public interface LedgerEvent {

    UUID getEventId();

    String getAccountId();

    /**
     * Instance whose store committed the change.
     */
    String getOriginInstanceId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();

    /**
     * Rebuilds the store change this event describes.
     */
    LedgerChange toChange();
}
