package com.flagship.wallet_ledger.outbox;

import com.flagship.wallet_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls the outbox and sends pending ledger events to Kafka.
 *
 * Events are sent one at a time in sequence order, keyed by account id, so
 * all changes of one account land on one partition in commit order. A send
 * that fails is retried on the next poll until the attempt limit is reached;
 * after that the event stays in the table for manual inspection.
 *
 * Delivery is at least once. With several instances polling, an event may be
 * sent by more than one of them; {@code IdempotentEventProcessor} drops the
 * duplicates on the consuming side.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-events:wallet-ledger-events}")
    private String ledgerEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-attempts:5}")
    private int maxAttempts;

    @Value("${outbox.publisher.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Value("${outbox.retention:P7D}")
    private Duration retention;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPending(batchSize, maxAttempts);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} pending outbox events", events.size());

            for (OutboxEvent event : events) {
                publish(event);
            }
        } catch (RuntimeException e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    @Scheduled(fixedRateString = "${outbox.purge-interval-ms:3600000}")
    public void purgePublishedEvents() {
        try {
            outboxService.purgePublishedBefore(Instant.now().minus(retention));
        } catch (RuntimeException e) {
            log.error("Error purging published outbox events", e);
        }
    }

    void publish(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(ledgerEventsTopic, event.getAccountId(), event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(event, "interrupted while sending");
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            fail(event, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void fail(OutboxEvent event, String error) {
        log.error("Failed to publish event: eventId={}, eventType={}, accountId={}, error={}",
                event.getId(), event.getEventType(), event.getAccountId(), error);
        outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());

        if (event.getAttempts() + 1 >= maxAttempts) {
            log.warn("Event {} reached {} failed attempts and will no longer be sent", event.getId(), maxAttempts);
            outboxMetrics.recordEventExhausted(event.getEventType());
        }
    }

    /**
     * Runs one publishing pass immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
