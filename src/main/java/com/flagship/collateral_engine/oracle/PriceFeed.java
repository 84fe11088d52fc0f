package com.flagship.collateral_engine.oracle;

/**
 * External USD price source for one asset.
 * Implementations may throw if the source cannot be reached.
 */
public interface PriceFeed {

    PriceReading latestPrice();
}
