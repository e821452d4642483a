package com.flagship.wallet_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.config.LedgerInstance;
import com.flagship.wallet_ledger.ledger.event.BalanceChangedEvent;
import com.flagship.wallet_ledger.ledger.event.LedgerEvent;
import com.flagship.wallet_ledger.ledger.event.TransactionAppendedEvent;
import com.flagship.wallet_ledger.notification.NotificationFanout;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Relays ledger changes committed by other instances into the local fan-out.
 *
 * Each instance listens with its own consumer group, so every instance sees
 * every change. Changes this instance committed itself were already delivered
 * by the local store and are acknowledged without processing.
 *
 * Offsets are committed manually after the event is handled; a failure leaves
 * the offset uncommitted and the record is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class LedgerEventConsumer {

    private final IdempotentEventProcessor eventProcessor;
    private final NotificationFanout fanout;
    private final LedgerInstance instance;
    private final LedgerMetrics metrics;
    private final ObjectMapper objectMapper;
    private final String consumerGroup;

    public LedgerEventConsumer(IdempotentEventProcessor eventProcessor,
                               NotificationFanout fanout,
                               LedgerInstance instance,
                               LedgerMetrics metrics,
                               ObjectMapper objectMapper,
                               @Value("${consumer.group-prefix:wallet-ledger-relay}") String groupPrefix) {
        this.eventProcessor = eventProcessor;
        this.fanout = fanout;
        this.instance = instance;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.consumerGroup = groupPrefix + "-" + instance.getId();
    }

    @KafkaListener(
        topics = "${kafka.topic.ledger-events:wallet-ledger-events}",
        groupId = "${consumer.group-prefix:wallet-ledger-relay}-#{@ledgerInstance.id}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received ledger event: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

        LedgerEvent event = parse(record.value());
        if (event == null) {
            log.warn("Unreadable ledger event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        if (instance.isSelf(event.getOriginInstanceId())) {
            ack.acknowledge();
            return;
        }

        boolean processed = eventProcessor.processEvent(
                event.getEventId(), event.getEventType(), event.getAccountId(), consumerGroup,
                () -> fanout.publish(event.toChange()));
        ack.acknowledge();

        if (processed) {
            metrics.recordChangeRelayed(event.getEventType());
            log.debug("Relayed {} for account {} from instance {}",
                    event.getEventType(), event.getAccountId(), event.getOriginInstanceId());
        }
    }

    /**
     * Reads the payload as the event type it names, or null if it cannot be read.
     */
    LedgerEvent parse(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            String eventType = node.path("eventType").asText("");
            return switch (eventType) {
                case BalanceChangedEvent.EVENT_TYPE -> objectMapper.treeToValue(node, BalanceChangedEvent.class);
                case TransactionAppendedEvent.EVENT_TYPE -> objectMapper.treeToValue(node, TransactionAppendedEvent.class);
                default -> {
                    log.warn("Unknown ledger event type '{}'", eventType);
                    yield null;
                }
            };
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse ledger event: {}", e.getMessage());
            return null;
        }
    }

    String getConsumerGroup() {
        return consumerGroup;
    }
}
