package com.flagship.collateral_engine.oracle;

import com.flagship.collateral_engine.collateral.PriceFeedId;
import com.flagship.collateral_engine.engine.exception.EngineError;
import com.flagship.collateral_engine.engine.exception.OracleFailureException;
import com.flagship.collateral_engine.ledger.Amounts;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wraps the price feed of one collateral asset.
 *
 * Responsibilities:
 * - Rejects readings older than {@code staleAfter} (OracleStale)
 * - Rejects unreachable feeds and nonsensical answers (OracleUnavailable)
 * - Normalizes the feed price to 18 decimals
 * - Converts between asset amounts and USD value with floor division
 *
 * A stale or missing price is never replaced by a cached or default value.
 */
@Slf4j
public class PriceOracleAdapter {

    @Getter
    private final PriceFeedId feedId;
    private final PriceFeedDirectory directory;
    private final Clock clock;
    private final Duration staleAfter;
    @Getter
    private final BigInteger additionalFeedPrecision;

    public PriceOracleAdapter(PriceFeedId feedId, PriceFeedDirectory directory, Clock clock,
                              Duration staleAfter, BigInteger additionalFeedPrecision) {
        this.feedId = feedId;
        this.directory = directory;
        this.clock = clock;
        this.staleAfter = staleAfter;
        this.additionalFeedPrecision = additionalFeedPrecision;
    }

    /**
     * Latest price scaled to 18 decimals.
     *
     * @throws OracleFailureException if the feed is unreachable, answers garbage or is stale
     */
    public BigInteger price() {
        PriceReading reading = readFeed();

        if (reading == null || reading.getPrice() == null || reading.getUpdatedAt() == null) {
            throw new OracleFailureException(EngineError.ORACLE_UNAVAILABLE,
                "Price feed " + feedId + " returned no reading");
        }
        if (reading.getPrice().signum() <= 0) {
            throw new OracleFailureException(EngineError.ORACLE_UNAVAILABLE,
                String.format("Price feed %s returned non-positive price %s", feedId, reading.getPrice()));
        }

        Instant now = clock.instant();
        if (reading.getUpdatedAt().isAfter(now)) {
            throw new OracleFailureException(EngineError.ORACLE_UNAVAILABLE,
                String.format("Price feed %s reported a future timestamp %s", feedId, reading.getUpdatedAt()));
        }
        Duration age = Duration.between(reading.getUpdatedAt(), now);
        if (age.compareTo(staleAfter) > 0) {
            log.warn("Stale price rejected: feed={}, age={}, staleAfter={}", feedId, age, staleAfter);
            throw new OracleFailureException(EngineError.ORACLE_STALE,
                String.format("Price feed %s last updated %s ago (limit %s)", feedId, age, staleAfter));
        }

        return reading.getPrice().multiply(additionalFeedPrecision);
    }

    /**
     * USD value (18 decimals) of {@code amount} units of the asset, rounded down.
     */
    public BigInteger usdValue(BigInteger amount) {
        return amount.multiply(price()).divide(Amounts.PRECISION);
    }

    /**
     * Asset amount worth {@code usdAmount}, rounded down.
     */
    public BigInteger tokenAmountForUsd(BigInteger usdAmount) {
        return usdAmount.multiply(Amounts.PRECISION).divide(price());
    }

    /**
     * Age of the latest reading, for health reporting. Propagates feed failures.
     */
    public Duration readingAge() {
        PriceReading reading = readFeed();
        if (reading == null || reading.getUpdatedAt() == null) {
            throw new OracleFailureException(EngineError.ORACLE_UNAVAILABLE,
                "Price feed " + feedId + " returned no reading");
        }
        return Duration.between(reading.getUpdatedAt(), clock.instant());
    }

    public Duration getStaleAfter() {
        return staleAfter;
    }

    private PriceReading readFeed() {
        PriceFeed feed = directory.find(feedId)
            .orElseThrow(() -> new OracleFailureException(EngineError.ORACLE_UNAVAILABLE,
                "No price feed registered under " + feedId));
        try {
            return feed.latestPrice();
        } catch (RuntimeException e) {
            log.error("Price feed unreachable: feed={}, error={}", feedId, e.getMessage());
            throw new OracleFailureException(EngineError.ORACLE_UNAVAILABLE,
                "Price feed " + feedId + " is unavailable", e);
        }
    }
}
