package com.flagship.wallet_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.ledger.event.LedgerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes ledger events to the outbox and tracks their delivery.
 *
 * {@link #record} joins the caller's transaction: if the balance or log
 * change rolls back, so does its event. Delivery bookkeeping runs in
 * transactions of its own so a failed send never undoes a mark.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves an event within the current transaction. The outbox row reuses
     * the event id so consumers can deduplicate on it.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent record(LedgerEvent event) {
        OutboxEvent pending = OutboxEvent.pending(
                event.getEventId(),
                event.getAccountId(),
                event.getEventType(),
                serializePayload(event));

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(pending));

        log.debug("Saved outbox event: type={}, accountId={}, eventId={}",
                event.getEventType(), event.getAccountId(), event.getEventId());

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPending(int limit, int maxAttempts) {
        return repository.findPendingForUpdate(limit, maxAttempts)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.recordFailedAttempt(errorMessage);
            repository.save(entity);
            log.warn("Delivery of event {} failed (attempt #{}): {}",
                    eventId, entity.getAttempts(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> eventsForAccount(String accountId) {
        return repository.findByAggregateIdOrderBySequenceNumberAsc(accountId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    /**
     * Deletes delivered events older than the cutoff.
     *
     * @return number of rows removed
     */
    @Transactional
    public int purgePublishedBefore(Instant cutoff) {
        int removed = repository.deletePublishedBefore(cutoff);
        if (removed > 0) {
            log.info("Purged {} published outbox events older than {}", removed, cutoff);
        }
        return removed;
    }

    private String serializePayload(LedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + event.getEventType() + " payload", e);
        }
    }
}
