package com.flagship.wallet_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations: Counter of deposits/transfers, tagged by operation and outcome
 * - ledger.operation.latency: Timer per operation
 * - ledger.store.retries: Counter of store transaction attempts retried after a write conflict
 * - ledger.log.recipient_append_failures: Counter of best-effort recipient log appends that failed
 * - ledger.subscriptions.active: Gauge of open balance/log subscriptions
 * - idempotency.cache: Counter of idempotency key lookups, tagged by result
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter storeRetries;
    private final Counter recipientAppendFailures;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.storeRetries = Counter.builder("ledger.store.retries")
                .description("Store transaction attempts retried after a write conflict")
                .register(registry);

        this.recipientAppendFailures = Counter.builder("ledger.log.recipient_append_failures")
                .description("Best-effort recipient log appends that failed")
                .register(registry);
    }

    // ==================== Operation Methods ====================

    /**
     * Records a finished deposit or transfer.
     * Outcome is "success" or the lower-case error kind.
     */
    public void recordOperation(String operation, String outcome) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void incrementStoreRetries() {
        storeRetries.increment();
    }

    public void incrementRecipientAppendFailures() {
        recipientAppendFailures.increment();
    }

    // ==================== Idempotency Methods ====================

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordIdempotencyOutcomeLost() {
        registry.counter("idempotency.outcome.lost").increment();
    }

    // ==================== Gauge Methods ====================

    /**
     * Registers a gauge for open subscriptions of the given stream type.
     */
    public void registerSubscriptionGauge(String stream, Supplier<Number> supplier) {
        Gauge.builder("ledger.subscriptions.active", supplier)
                .description("Open subscriptions per stream type")
                .tags(Tags.of("stream", stream))
                .strongReference(true)
                .register(registry);
    }

    // ==================== Relay Methods ====================

    public void recordChangeRelayed(String eventType) {
        registry.counter("ledger.changes.relayed",
                "event_type", sanitizeTag(eventType)
        ).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
