package com.flagship.collateral_engine.ledger.event;

/**
 * Receives collateral events after the operation that produced them committed.
 */
@FunctionalInterface
public interface CollateralEventPublisher {

    void publish(CollateralEvent event);
}
