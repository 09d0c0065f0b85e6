package com.flagship.credit_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the transaction engine.
 *
 * Metrics exposed:
 * - ledger.transactions: counter tagged by type and outcome (created, replayed, or an error outcome)
 * - ledger.idempotency: counter tagged result=hit|miss
 * - ledger.transaction.latency: timer tagged by type
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransaction(String type, String outcome) {
        registry.counter("ledger.transactions",
                "type", sanitizeTag(type),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency", "result", "miss").increment();
    }

    public void recordLatency(String type, Duration duration) {
        registry.timer("ledger.transaction.latency",
                "type", sanitizeTag(type)
        ).record(duration);
    }

    /**
     * Keeps tag values bounded so a bad input cannot blow up meter cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
