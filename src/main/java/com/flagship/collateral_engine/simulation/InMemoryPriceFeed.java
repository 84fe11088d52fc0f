package com.flagship.collateral_engine.simulation;

import com.flagship.collateral_engine.oracle.PriceFeed;
import com.flagship.collateral_engine.oracle.PriceReading;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Price feed whose answer is set by hand.
 */
public class InMemoryPriceFeed implements PriceFeed {

    private volatile PriceReading reading;

    public InMemoryPriceFeed(BigInteger price, Instant updatedAt) {
        this.reading = new PriceReading(price, updatedAt);
    }

    public void update(BigInteger price, Instant updatedAt) {
        this.reading = new PriceReading(price, updatedAt);
    }

    @Override
    public PriceReading latestPrice() {
        return reading;
    }
}
