package com.flagship.collateral_engine.oracle;

import com.flagship.collateral_engine.collateral.PriceFeedId;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;

/**
 * Builds adapters that share one directory, clock and staleness window.
 */
public class PriceOracleAdapterFactory {

    private static final int INTERNAL_DECIMALS = 18;

    private final PriceFeedDirectory directory;
    private final Clock clock;
    private final Duration staleAfter;
    private final BigInteger additionalFeedPrecision;

    public PriceOracleAdapterFactory(PriceFeedDirectory directory, Clock clock,
                                     Duration staleAfter, int feedDecimals) {
        if (feedDecimals < 0 || feedDecimals > INTERNAL_DECIMALS) {
            throw new IllegalArgumentException("Feed decimals must be between 0 and 18, got " + feedDecimals);
        }
        if (staleAfter == null || staleAfter.isNegative() || staleAfter.isZero()) {
            throw new IllegalArgumentException("Staleness window must be positive");
        }
        this.directory = directory;
        this.clock = clock;
        this.staleAfter = staleAfter;
        this.additionalFeedPrecision = BigInteger.TEN.pow(INTERNAL_DECIMALS - feedDecimals);
    }

    public PriceOracleAdapter create(PriceFeedId feedId) {
        return new PriceOracleAdapter(feedId, directory, clock, staleAfter, additionalFeedPrecision);
    }

    public BigInteger getAdditionalFeedPrecision() {
        return additionalFeedPrecision;
    }
}
