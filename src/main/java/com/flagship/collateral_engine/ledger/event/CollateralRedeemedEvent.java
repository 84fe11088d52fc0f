package com.flagship.collateral_engine.ledger.event;

import com.flagship.collateral_engine.collateral.AssetId;
import com.flagship.collateral_engine.ledger.AccountId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when collateral leaves an account, either redeemed by its owner or
 * seized by a liquidator ({@code to} differs from {@code from}).
 */
@Value
public class CollateralRedeemedEvent implements CollateralEvent {
    UUID eventId;
    AccountId from;
    AccountId to;
    AssetId asset;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CollateralRedeemed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CollateralRedeemedEvent of(AccountId from, AccountId to, AssetId asset, BigInteger amount) {
        return new CollateralRedeemedEvent(UUID.randomUUID(), from, to, asset, amount, Instant.now());
    }
}
