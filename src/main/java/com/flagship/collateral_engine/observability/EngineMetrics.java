package com.flagship.collateral_engine.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for engine operations.
 *
 * Metrics exposed:
 * - engine.operations: Counter tagged by operation and outcome (success or error code)
 * - engine.operation.latency: Timer tagged by operation
 * - engine.liquidations: Counter of executed liquidations tagged by collateral asset
 * - engine.collateral.events: Counter of published collateral events tagged by type
 */
@Component
public class EngineMetrics {

    private final MeterRegistry registry;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, String outcome) {
        registry.counter("engine.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("engine.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordLiquidation(String asset) {
        registry.counter("engine.liquidations", "asset", sanitizeTag(asset)).increment();
    }

    public void recordCollateralEvent(String eventType) {
        registry.counter("engine.collateral.events", "event_type", sanitizeTag(eventType)).increment();
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
