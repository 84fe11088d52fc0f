package com.flagship.collateral_engine.ledger.event;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Forwards committed collateral events to Spring application listeners.
 */
@Component
@RequiredArgsConstructor
public class SpringCollateralEventPublisher implements CollateralEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public void publish(CollateralEvent event) {
        applicationEventPublisher.publishEvent(event);
    }
}
