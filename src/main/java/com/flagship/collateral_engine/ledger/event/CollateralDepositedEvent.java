package com.flagship.collateral_engine.ledger.event;

import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.ledger.AccountId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when collateral is credited to an account.
 */
@Value
public class CollateralDepositedEvent implements CollateralEvent {
    UUID eventId;
    AccountId account;
    AssetId asset;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CollateralDeposited";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CollateralDepositedEvent of(AccountId account, AssetId asset, BigInteger amount) {
        return new CollateralDepositedEvent(UUID.randomUUID(), account, asset, amount, Instant.now());
    }
}
