package com.flagship.wallet_ledger.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of processed_events. One row per (event, consumer group):
 * each instance relays with its own group, so the same event appears once per instance.
 */
@Entity
@Table(name = "processed_events",
       uniqueConstraints = @UniqueConstraint(name = "uq_processed_events_group",
                                             columnNames = {"event_id", "consumer_group"}))
@Getter
@Setter
@NoArgsConstructor
public class ProcessedEventEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "account_id", nullable = false, length = 128)
    private String accountId;

    @Column(name = "consumer_group", nullable = false, length = 100)
    private String consumerGroup;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", length = 50)
    private ProcessedEvent.ProcessingResult processingResult;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    public static ProcessedEventEntity fromDomain(ProcessedEvent event) {
        ProcessedEventEntity entity = new ProcessedEventEntity();
        entity.setId(UUID.randomUUID());
        entity.setEventId(event.getEventId());
        entity.setEventType(event.getEventType());
        entity.setAccountId(event.getAccountId());
        entity.setConsumerGroup(event.getConsumerGroup());
        entity.setProcessedAt(event.getProcessedAt());
        entity.setProcessingResult(event.getResult());
        entity.setErrorMessage(event.getErrorMessage());
        return entity;
    }

    public ProcessedEvent toDomain() {
        return new ProcessedEvent(eventId, eventType, accountId, consumerGroup,
                processedAt, processingResult, errorMessage);
    }
}
