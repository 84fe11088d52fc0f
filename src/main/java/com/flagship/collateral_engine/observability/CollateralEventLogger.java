package com.flagship.collateral_engine.observability;

import com.flagship.collateral_engine.ledger.event.CollateralDepositedEvent;
import com.flagship.collateral_engine.ledger.event.CollateralRedeemedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Audit trail of committed collateral movements.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CollateralEventLogger {

    private final EngineMetrics metrics;

    @EventListener
    public void onDeposited(CollateralDepositedEvent event) {
        metrics.recordCollateralEvent(event.getEventType());
        log.info("CollateralDeposited: eventId={}, account={}, asset={}, amount={}",
            event.getEventId(), event.getAccount(), event.getAsset(), event.getAmount());
    }

    @EventListener
    public void onRedeemed(CollateralRedeemedEvent event) {
        metrics.recordCollateralEvent(event.getEventType());
        log.info("CollateralRedeemed: eventId={}, from={}, to={}, asset={}, amount={}",
            event.getEventId(), event.getFrom(), event.getTo(), event.getAsset(), event.getAmount());
    }
}
