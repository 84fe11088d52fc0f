package com.flagship.collateral_engine.engine;

import com.flagship.collateral_engine.ledger.LedgerSnapshot;
import com.flagship.collateral_engine.ledger.PositionLedger;
import com.flagship.collateral_engine.ledger.event.CollateralEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Unit of work for one engine operation.
 *
 * Captures the ledger before the operation starts and remembers how to undo every
 * collaborator call that already succeeded. On rollback the ledger is restored,
 * compensations run newest first, and events recorded by the operation are dropped.
 * On commit the recorded events are released for publishing.
 */
@Slf4j
class EngineTransaction {

    private final PositionLedger ledger;
    private final LedgerSnapshot snapshot;
    private final Deque<Compensation> compensations = new ArrayDeque<>();

    EngineTransaction(PositionLedger ledger) {
        this.ledger = ledger;
        this.snapshot = ledger.snapshot();
    }

    void onRollback(String description, BooleanSupplier action) {
        compensations.push(new Compensation(description, action));
    }

    List<CollateralEvent> commit() {
        compensations.clear();
        return ledger.commit();
    }

    void rollback(Throwable cause) {
        ledger.restore(snapshot);
        while (!compensations.isEmpty()) {
            Compensation compensation = compensations.pop();
            try {
                if (!compensation.action().getAsBoolean()) {
                    log.error("Compensation refused: {}", compensation.description());
                    cause.addSuppressed(new IllegalStateException("Compensation refused: " + compensation.description()));
                } else {
                    log.debug("Compensation applied: {}", compensation.description());
                }
            } catch (RuntimeException e) {
                log.error("Compensation failed: {}, error={}", compensation.description(), e.getMessage());
                cause.addSuppressed(e);
            }
        }
    }

    private record Compensation(String description, BooleanSupplier action) {
    }
}
