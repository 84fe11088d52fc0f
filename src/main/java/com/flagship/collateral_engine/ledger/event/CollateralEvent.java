package com.flagship.collateral_engine.ledger.event;

import com.flagship.collateral_engine.collateral.AssetId;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Fact about a committed collateral balance change.
 */
public interface CollateralEvent {

    UUID getEventId();

    AssetId getAsset();

    BigInteger getAmount();

    Instant getOccurredAt();

    String getEventType();
}
