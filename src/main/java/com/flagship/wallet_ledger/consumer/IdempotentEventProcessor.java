package com.flagship.wallet_ledger.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Runs an event handler at most once per consumer group.
 *
 * The processed record is written in the same transaction as the check, so
 * a handler that throws leaves no record and the event is handled again on
 * redelivery.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    @Value("${consumer.processed-retention:P7D}")
    private Duration retention;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType, String accountId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("Failed to process event {} ({}) for account {} in group {}: {}",
                    eventId, eventType, accountId, consumerGroup, e.getMessage(), e);
            throw e;
        }

        repository.save(ProcessedEventEntity.fromDomain(
                ProcessedEvent.success(eventId, eventType, accountId, consumerGroup)));
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    @Scheduled(fixedRateString = "${consumer.purge-interval-ms:3600000}")
    @Transactional
    public void purgeExpired() {
        int removed = repository.deleteProcessedBefore(Instant.now().minus(retention));
        if (removed > 0) {
            log.info("Purged {} processed event records older than {}", removed, retention);
        }
    }
}
