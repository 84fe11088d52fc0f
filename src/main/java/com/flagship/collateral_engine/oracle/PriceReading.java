package com.flagship.collateral_engine.oracle;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One answer from a price feed, in the feed's native precision.
 */
@Value
public class PriceReading {
    BigInteger price;
    Instant updatedAt;
}
